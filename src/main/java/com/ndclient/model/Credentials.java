package com.ndclient.model;

import com.ndclient.exception.CredentialException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The effective credentials used to log in to the controller, resolved once per run.
 * <p>
 * Construction fails with a {@link CredentialException} naming every required field that is
 * still blank, so an instance of this record is always complete. The domain and the NX-OS
 * switch credentials are optional.
 *
 * @param address      The controller address (IPv4 address or host name, optionally with a port).
 * @param username     The controller username.
 * @param password     The controller password.
 * @param domain       The login domain, or {@code null} to use the controller default.
 * @param nxosUsername The NX-OS switch username, or {@code null}.
 * @param nxosPassword The NX-OS switch password, or {@code null}.
 */
public record Credentials(String address, String username, String password, String domain,
                          String nxosUsername, String nxosPassword) {

    public static final String DEFAULT_DOMAIN = "local";

    public Credentials {
        List<String> missing = new ArrayList<>();
        if (isBlank(address)) {
            missing.add("address");
        }
        if (isBlank(username)) {
            missing.add("username");
        }
        if (isBlank(password)) {
            missing.add("password");
        }
        if (!missing.isEmpty()) {
            throw new CredentialException("Missing required controller credential(s): " + String.join(", ", missing)
                    + ". Supply them as arguments, environment variables or vault entries.");
        }
        domain = isBlank(domain) ? null : domain;
        nxosUsername = isBlank(nxosUsername) ? null : nxosUsername;
        nxosPassword = isBlank(nxosPassword) ? null : nxosPassword;
    }

    public Credentials(String address, String username, String password) {
        this(address, username, password, null, null, null);
    }

    /**
     * @return The resolved domain, or {@value #DEFAULT_DOMAIN} when none was supplied.
     */
    public String domainOrDefault() {
        return domain != null ? domain : DEFAULT_DOMAIN;
    }

    public Optional<String> nxosUsernameValue() {
        return Optional.ofNullable(nxosUsername);
    }

    public Optional<String> nxosPasswordValue() {
        return Optional.ofNullable(nxosPassword);
    }

    @Override
    public String toString() {
        return "Credentials[address=" + address + ", username=" + username + ", password=****, domain=" + domain
                + ", nxosUsername=" + nxosUsername + ", nxosPassword=" + (nxosPassword != null ? "****" : null) + "]";
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
