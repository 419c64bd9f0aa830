package com.flagship.fuel_ledger.release;

import com.flagship.fuel_ledger.account.AccountService;
import com.flagship.fuel_ledger.config.FuelLedgerProperties;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Assembles the "new version deployed" notice.
 *
 * The version comes from fuel.release.version, then from the build info, then "unknown".
 * Sending the notice belongs to the transport.
 */
@Service
public class ReleaseNoticeService {

    static final String DEFAULT_CHANGE_DESCRIPTION = "Version updated. See release notes for details.";
    static final String UNKNOWN_VERSION = "unknown";

    private final AccountService accountService;
    private final FuelLedgerProperties.Release release;
    private final BuildProperties buildProperties;

    public ReleaseNoticeService(AccountService accountService,
                                FuelLedgerProperties properties,
                                ObjectProvider<BuildProperties> buildProperties) {
        this.accountService = accountService;
        this.release = properties.release();
        this.buildProperties = buildProperties.getIfAvailable();
    }

    public String currentVersion() {
        if (release.version() != null && !release.version().isBlank()) {
            return release.version();
        }
        if (buildProperties != null && buildProperties.getVersion() != null) {
            return buildProperties.getVersion();
        }
        return UNKNOWN_VERSION;
    }

    public String changeDescription() {
        String description = release.changeDescription();
        return description == null || description.isBlank() ? DEFAULT_CHANGE_DESCRIPTION : description;
    }

    public List<String> notificationTargets() {
        return accountService.notificationDestinations();
    }

    public ReleaseNotice compose() {
        return new ReleaseNotice(currentVersion(), changeDescription(), notificationTargets());
    }
}
