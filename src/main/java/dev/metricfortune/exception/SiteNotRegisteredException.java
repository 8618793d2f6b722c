package dev.metricfortune.exception;

/**
 * Tracking batch for a siteId that no business owns.
 */
public class SiteNotRegisteredException extends RuntimeException {

    private final String siteId;

    public SiteNotRegisteredException(String siteId) {
        super("error.invalid_site");
        this.siteId = siteId;
    }

    public String getSiteId() {
        return siteId;
    }
}
