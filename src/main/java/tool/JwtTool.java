package tool;

import codec.JsonCodec;
import config.ToolConfig;
import expiration.Expiration;
import jwt.JwtResult;
import jwt.decoder.JwtDecoder;
import jwt.encoder.JwtEncoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Command line front end.
 * <pre>
 * java tool.JwtTool encode &lt;config.properties&gt; '&lt;claims json&gt;'
 * java tool.JwtTool decode &lt;config.properties&gt; &lt;token&gt;
 * </pre>
 */
public class JwtTool {
    private static final Logger logger = LoggerFactory.getLogger(JwtTool.class);

    static final int OK = 0;
    static final int REJECTED = 1;
    static final int USAGE = 2;

    private final JwtEncoder encoder;
    private final JwtDecoder decoder;

    JwtTool(JwtEncoder encoder, JwtDecoder decoder) {
        this.encoder = encoder;
        this.decoder = decoder;
    }

    public static void main(String[] args) {
        int status = new JwtTool(new JwtEncoder(), new JwtDecoder()).run(args, System.out, System.err);
        if (status != OK) {
            System.exit(status);
        }
    }

    int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length != 3) {
            printUsage(err);
            return USAGE;
        }
        ToolConfig config;
        try {
            config = ToolConfig.load(Path.of(args[1]));
        } catch (UncheckedIOException e) {
            err.println(e.getMessage());
            return USAGE;
        }

        try {
            switch (args[0]) {
                case "encode":
                    return encode(config, args[2], out, err);
                case "decode":
                    return decode(config, args[2], out, err);
                default:
                    printUsage(err);
                    return USAGE;
            }
        } catch (IllegalArgumentException | IllegalStateException | UncheckedIOException e) {
            logger.debug("{} failed", args[0], e);
            err.println(e.getMessage());
            return USAGE;
        }
    }

    private int encode(ToolConfig config, String claimsJson, PrintStream out, PrintStream err) {
        Optional<Map<String, Object>> claims = JsonCodec.decodeObject(claimsJson);
        if (claims.isEmpty()) {
            err.println("Claims must be a JSON object");
            return USAGE;
        }
        Optional<Expiration> expiration = config.getExpiration();
        JwtResult<String> token = expiration.isPresent()
                ? encoder.encode(config.getAlgorithm(), claims.get(), expiration.get(), config.signingKey())
                : encoder.encode(config.getAlgorithm(), claims.get(), config.signingKey());
        if (!token.isOk()) {
            err.println(token.getError().getCode());
            return REJECTED;
        }
        out.println(token.getValue());
        return OK;
    }

    private int decode(ToolConfig config, String token, PrintStream out, PrintStream err) {
        JwtResult<Map<String, Object>> claims = decoder.decode(token.trim(), config.verificationKey());
        if (!claims.isOk()) {
            err.println(claims.getError().getCode());
            return REJECTED;
        }
        out.println(JsonCodec.encode(claims.getValue()).orElseThrow());
        return OK;
    }

    private static void printUsage(PrintStream err) {
        err.println("Usage: java tool.JwtTool encode <config.properties> <claims-json>");
        err.println("       java tool.JwtTool decode <config.properties> <token>");
    }
}
