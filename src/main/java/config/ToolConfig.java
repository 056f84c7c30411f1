package config;

import expiration.Expiration;
import key.KeyMaterial;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.Properties;

/**
 * Settings of the {@code JwtTool} command line, read from a properties file:
 * <pre>
 * jwt.algorithm=RS256
 * jwt.privateKeyFile=keys/private.pem
 * jwt.publicKeyFile=keys/public.pem
 * jwt.expirationSeconds=3600
 * </pre>
 * HMAC algorithms use {@code jwt.secret} instead of the key files. Relative key
 * paths are resolved against the directory holding the properties file.
 */
public final class ToolConfig {
    public static final String ALGORITHM = "jwt.algorithm";
    public static final String SECRET = "jwt.secret";
    public static final String PRIVATE_KEY_FILE = "jwt.privateKeyFile";
    public static final String PUBLIC_KEY_FILE = "jwt.publicKeyFile";
    public static final String EXPIRATION_SECONDS = "jwt.expirationSeconds";

    public static final String DEFAULT_ALGORITHM = "HS256";

    private final Properties props;
    private final Path baseDir;

    ToolConfig(Properties props, Path baseDir) {
        this.props = props;
        this.baseDir = baseDir;
    }

    /**
     * Loads the tool settings.
     * @throws UncheckedIOException if the file cannot be read.
     */
    public static ToolConfig load(Path file) {
        Properties props = new Properties();
        try (InputStream in = Files.newInputStream(file)) {
            props.load(in);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to load configuration from file: " + file, ex);
        }
        Path parent = file.toAbsolutePath().getParent();
        return new ToolConfig(props, parent);
    }

    public String getAlgorithm() {
        return props.getProperty(ALGORITHM, DEFAULT_ALGORITHM).trim();
    }

    /**
     * @return the token lifetime, or empty if tokens should not carry {@code exp}.
     * @throws IllegalArgumentException if the value is not a non-negative number.
     */
    public Optional<Expiration> getExpiration() {
        String value = props.getProperty(EXPIRATION_SECONDS);
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Expiration.seconds(Long.parseLong(value.trim())));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(EXPIRATION_SECONDS + " is not a number: " + value, e);
        }
    }

    /**
     * @return the shared secret if configured, otherwise the private key file as PEM.
     */
    public KeyMaterial signingKey() {
        Optional<KeyMaterial> secret = secret();
        if (secret.isPresent()) {
            return secret.get();
        }
        return pemFile(PRIVATE_KEY_FILE)
                .orElseThrow(() -> new IllegalStateException("Neither " + SECRET + " nor " + PRIVATE_KEY_FILE + " is set"));
    }

    /**
     * @return the shared secret if configured, otherwise the public key file, falling back to the private key file.
     */
    public KeyMaterial verificationKey() {
        Optional<KeyMaterial> secret = secret();
        if (secret.isPresent()) {
            return secret.get();
        }
        return pemFile(PUBLIC_KEY_FILE)
                .or(() -> pemFile(PRIVATE_KEY_FILE))
                .orElseThrow(() -> new IllegalStateException("No verification key configured: set "
                        + SECRET + ", " + PUBLIC_KEY_FILE + " or " + PRIVATE_KEY_FILE));
    }

    private Optional<KeyMaterial> secret() {
        String secret = props.getProperty(SECRET);
        if (secret == null || secret.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(KeyMaterial.secret(secret));
    }

    private Optional<KeyMaterial> pemFile(String property) {
        String location = props.getProperty(property);
        if (location == null || location.isBlank()) {
            return Optional.empty();
        }
        Path path = baseDir == null ? Path.of(location.trim()) : baseDir.resolve(location.trim());
        try {
            return Optional.of(KeyMaterial.pem(Files.readAllBytes(path)));
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to load key from file: " + path, ex);
        }
    }
}
