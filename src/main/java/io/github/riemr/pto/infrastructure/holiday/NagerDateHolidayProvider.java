package io.github.riemr.pto.infrastructure.holiday;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.github.riemr.pto.application.exception.HolidayProviderException;
import io.github.riemr.pto.application.gateway.HolidayProvider;
import io.github.riemr.pto.domain.model.Holiday;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Public holidays from Nager.Date ({@code /api/v3/PublicHolidays/{year}/{country}}).
 * Observed dates move between years, so every imported holiday is non-repeating.
 */
@Component
@Slf4j
public class NagerDateHolidayProvider implements HolidayProvider {

    private final RestTemplate restTemplate;
    private final String baseUrl;
    private final String userAgent;

    public NagerDateHolidayProvider(RestTemplate holidayRestTemplate,
                                    @Value("${pto.holidays.base-url:https://date.nager.at}") String baseUrl,
                                    @Value("${pto.holidays.user-agent:PTO-Planner/1.0}") String userAgent) {
        this.restTemplate = holidayRestTemplate;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.userAgent = userAgent;
    }

    @Override
    public List<Holiday> fetchHolidays(String countryCode, int year) {
        String country = countryCode.toUpperCase(Locale.ROOT);
        String url = baseUrl + "/api/v3/PublicHolidays/{year}/{country}";
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.USER_AGENT, userAgent);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        ResponseEntity<PublicHoliday[]> response;
        try {
            response = restTemplate.exchange(url, HttpMethod.GET, new HttpEntity<>(headers),
                    PublicHoliday[].class, year, country);
        } catch (HttpStatusCodeException e) {
            if (e.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
                throw new HolidayProviderException("Country not found or no holidays available: " + country, true);
            }
            throw new HolidayProviderException("Holiday provider returned " + e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            throw new HolidayProviderException("Holiday provider unreachable: " + e.getMessage(), e);
        }

        PublicHoliday[] body = response.getBody();
        List<Holiday> holidays = new ArrayList<>();
        if (body == null) {
            log.warn("Holiday provider returned an empty body: country={}, year={}", country, year);
            return holidays;
        }
        for (PublicHoliday p : body) {
            if (p.date() == null) continue;
            String name = p.localName() != null && !p.localName().isBlank() ? p.localName() : p.name();
            holidays.add(Holiday.builder()
                    .name(name)
                    .date(p.date())
                    .repeatsYearly(false)
                    .paid(true)
                    .countryCode(country)
                    .build());
        }
        log.debug("Fetched {} holidays: country={}, year={}", holidays.size(), country, year);
        return holidays;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PublicHoliday(LocalDate date, String localName, String name, String countryCode) {}
}
