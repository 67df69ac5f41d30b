package io.github.riemr.pto.application.command;

import io.github.riemr.pto.domain.model.LedgerSettings;
import lombok.Value;

@Value
public class SaveSettingsCommand {
    String userId;
    LedgerSettings settings;
}
