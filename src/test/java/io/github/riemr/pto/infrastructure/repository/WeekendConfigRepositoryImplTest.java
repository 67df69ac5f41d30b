package io.github.riemr.pto.infrastructure.repository;

import io.github.riemr.pto.infrastructure.mapper.WeekendConfigMapper;
import io.github.riemr.pto.infrastructure.persistence.entity.WeekendConfigRow;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.DayOfWeek;
import java.util.EnumSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WeekendConfigRepositoryImplTest {

    @Test
    void encode_writesSortedSundayBasedIndexes() {
        assertThat(WeekendConfigRepositoryImpl.encode(EnumSet.of(DayOfWeek.SATURDAY, DayOfWeek.SUNDAY))).isEqualTo("0,6");
        assertThat(WeekendConfigRepositoryImpl.decode(" 5, 6")).containsExactlyInAnyOrder(DayOfWeek.FRIDAY, DayOfWeek.SATURDAY);
        assertThat(WeekendConfigRepositoryImpl.decode("")).isEmpty();
    }

    @Test
    void save_insertsWhenNoRowWasUpdated() {
        WeekendConfigMapper mapper = mock(WeekendConfigMapper.class);
        when(mapper.update(any())).thenReturn(0);
        WeekendConfigRepositoryImpl repository = new WeekendConfigRepositoryImpl(mapper);

        repository.save("u1", EnumSet.of(DayOfWeek.FRIDAY));

        ArgumentCaptor<WeekendConfigRow> row = ArgumentCaptor.forClass(WeekendConfigRow.class);
        verify(mapper).insert(row.capture());
        assertThat(row.getValue().getUserId()).isEqualTo("u1");
        assertThat(row.getValue().getWeekendDays()).isEqualTo("5");
    }

    @Test
    void find_isEmptyWhenNothingStored() {
        WeekendConfigMapper mapper = mock(WeekendConfigMapper.class);
        assertThat(new WeekendConfigRepositoryImpl(mapper).find("u1")).isEmpty();
    }
}
