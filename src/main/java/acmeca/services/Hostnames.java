package acmeca.services;

import java.util.Collection;
import java.util.regex.Pattern;

public final class Hostnames {

    private static final Pattern LABEL = Pattern.compile("[a-z0-9]([a-z0-9-]{0,61}[a-z0-9])?");
    private static final int MAX_LENGTH = 253;

    private Hostnames() {}

    /**
     * @param host lower-cased DNS name without a trailing dot and without a wildcard prefix
     */
    public static boolean isValid(String host) {
        if (host == null || host.isEmpty() || host.length() > MAX_LENGTH) {
            return false;
        }
        for (String label : host.split("\\.", -1)) {
            if (!LABEL.matcher(label).matches()) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return true when {@code host} equals one of the domains or is a subdomain of one
     */
    public static boolean isWithin(String host, Collection<String> domains) {
        for (String domain : domains) {
            if (host.equals(domain) || host.endsWith("." + domain)) {
                return true;
            }
        }
        return false;
    }
}
