package io.relaybox.cli;

import io.relaybox.config.RelayBoxConfig;
import io.relaybox.mailbox.RecipientId;
import io.relaybox.relay.RelayService;
import io.relaybox.relay.RelayTokenSigner;
import io.relaybox.runtime.RelayBoxRuntime;
import io.relaybox.security.Ed25519Keys;
import io.relaybox.security.HmacKey;
import io.relaybox.security.MailboxScope;
import io.relaybox.security.MailboxTokenIssuer;
import io.relaybox.security.SensitiveDataMasker;
import io.relaybox.util.Hashing;
import io.relaybox.util.Jsons;
import io.relaybox.web.MailboxHttpApi;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.security.KeyPair;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

@Command(
        name = "relaybox",
        mixinStandardHelpOptions = true,
        version = RelayBoxConfig.VERSION,
        description = "Signaling mailbox and capability-gated relay",
        subcommands = {
                RelayBoxCommand.ServeCommand.class,
                RelayBoxCommand.ServeMailboxCommand.class,
                RelayBoxCommand.ServeRelayCommand.class,
                RelayBoxCommand.KeygenCommand.class,
                RelayBoxCommand.MintRelayTokenCommand.class,
                RelayBoxCommand.MintMailboxTokenCommand.class,
                RelayBoxCommand.CheckConfigCommand.class
        }
)
public final class RelayBoxCommand implements Runnable {
    @Option(names = {"--config"}, description = "Settings file (JSON)", defaultValue = RelayBoxConfig.SETTINGS_FILE_NAME)
    Path configFile;

    @Option(names = {"--mailbox-port"}, description = "Override the mailbox HTTP port")
    Integer mailboxPort;

    @Option(names = {"--relay-port"}, description = "Override the relay TCP port")
    Integer relayPort;

    @Override
    public void run() {
        System.out.println("Use subcommands: serve | serve-mailbox | serve-relay | keygen | mint-relay-token | mint-mailbox-token | check-config");
    }

    RelayBoxConfig config() {
        RelayBoxConfig loaded = RelayBoxConfig.load(configFile);
        return loaded.withPorts(
                mailboxPort == null ? loaded.mailboxPort() : mailboxPort,
                relayPort == null ? loaded.relayPort() : relayPort
        );
    }

    static int serve(RelayBoxConfig config, boolean mailbox, boolean relay) throws Exception {
        RelayBoxRuntime runtime = new RelayBoxRuntime(config);
        MailboxHttpApi http = mailbox ? new MailboxHttpApi(runtime) : null;
        runtime.startSweeper();
        Map<String, Object> started = new LinkedHashMap<>();
        started.put("version", RelayBoxConfig.VERSION);
        if (http != null) {
            http.start();
            started.put("mailbox_port", http.port());
        }
        if (relay) {
            RelayService relayService = runtime.startRelay();
            started.put("relay_port", relayService.port());
        }
        System.out.println(Jsons.toJson(started));

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            runtime.drain();
            if (http != null) {
                http.close();
            }
            runtime.close();
            stopped.countDown();
        }, "relaybox-shutdown-hook"));
        stopped.await();
        return 0;
    }

    @Command(name = "serve", description = "Run the mailbox HTTP API and the relay")
    static final class ServeCommand implements Callable<Integer> {
        @ParentCommand
        RelayBoxCommand parent;

        @Override
        public Integer call() throws Exception {
            return serve(parent.config(), true, true);
        }
    }

    @Command(name = "serve-mailbox", description = "Run only the mailbox HTTP API")
    static final class ServeMailboxCommand implements Callable<Integer> {
        @ParentCommand
        RelayBoxCommand parent;

        @Override
        public Integer call() throws Exception {
            return serve(parent.config(), true, false);
        }
    }

    @Command(name = "serve-relay", description = "Run only the relay")
    static final class ServeRelayCommand implements Callable<Integer> {
        @ParentCommand
        RelayBoxCommand parent;

        @Override
        public Integer call() throws Exception {
            return serve(parent.config(), false, true);
        }
    }

    @Command(name = "keygen", description = "Generate an Ed25519 device identity key pair")
    static final class KeygenCommand implements Callable<Integer> {
        @Override
        public Integer call() {
            KeyPair pair = Ed25519Keys.generate();
            byte[] publicKey = Ed25519Keys.rawPublicKey(pair.getPublic());
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("device_id", Hashing.hex(Hashing.sha256(publicKey)));
            out.put("public_key", Base64.getEncoder().encodeToString(publicKey));
            out.put("private_key", Base64.getEncoder().encodeToString(pair.getPrivate().getEncoded()));
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "mint-relay-token", description = "Sign a relay capability token with a device key")
    static final class MintRelayTokenCommand implements Callable<Integer> {
        @Option(names = {"--private-key"}, required = true, description = "Device private key, base64 PKCS#8")
        String privateKey;

        @Option(names = {"--device-id"}, required = true, description = "Device id, 64 hex chars")
        String deviceId;

        @Option(names = {"--peer-id"}, required = true, description = "Peer id, 64 hex chars")
        String peerId;

        @Option(names = {"--relay-id"}, defaultValue = "00000000000000000000000000000000", description = "Relay id, 32 hex chars")
        String relayId;

        @Option(names = {"--ttl-seconds"}, defaultValue = "3600", description = "Token lifetime")
        long ttlSeconds;

        @Option(names = {"--quota-bytes"}, defaultValue = "0", description = "Quota; 0 uses the relay default")
        long quotaBytes;

        @Option(names = {"--bandwidth-bps"}, defaultValue = "0", description = "Bandwidth; 0 uses the relay default")
        long bandwidthBps;

        @Override
        public Integer call() {
            HexFormat hex = HexFormat.of();
            RelayTokenSigner signer = new RelayTokenSigner(
                    Ed25519Keys.privateKey(privateKey),
                    hex.parseHex(deviceId),
                    Clock.systemUTC()
            );
            byte[] token = signer.mint(
                    hex.parseHex(relayId),
                    hex.parseHex(peerId),
                    Duration.ofSeconds(ttlSeconds),
                    bandwidthBps,
                    quotaBytes
            );
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("token", Base64.getEncoder().encodeToString(token));
            out.put("expires_in_seconds", ttlSeconds);
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "mint-mailbox-token", description = "Issue an HMAC mailbox bearer token")
    static final class MintMailboxTokenCommand implements Callable<Integer> {
        @Option(names = {"--kid"}, required = true, description = "Key id from mailboxTokenKeys")
        String kid;

        @Option(names = {"--secret"}, required = true, description = "Key secret, base64")
        String secret;

        @Option(names = {"--recipient"}, description = "Recipient id (hex); omit for a server-wide token")
        String recipient;

        @Option(names = {"--scope"}, defaultValue = "any", description = "post | get | any")
        String scope;

        @Option(names = {"--ttl-seconds"}, defaultValue = "3600", description = "Token lifetime")
        long ttlSeconds;

        @Override
        public Integer call() {
            MailboxTokenIssuer issuer = new MailboxTokenIssuer(HmacKey.fromBase64(kid, secret, null), Clock.systemUTC());
            MailboxScope parsedScope = MailboxScope.parse(scope);
            Duration ttl = Duration.ofSeconds(ttlSeconds);
            String token = recipient == null || recipient.isBlank()
                    ? issuer.issueServerWide(parsedScope, ttl)
                    : issuer.issueFor(RecipientId.parseHex(recipient.trim()), parsedScope, ttl);
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("token", token);
            out.put("expires_in_seconds", ttlSeconds);
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "check-config", description = "Validate the settings file and print the effective configuration")
    static final class CheckConfigCommand implements Callable<Integer> {
        @ParentCommand
        RelayBoxCommand parent;

        @Override
        @SuppressWarnings("unchecked")
        public Integer call() {
            RelayBoxConfig config = parent.config();
            try {
                config.validate();
            } catch (IllegalArgumentException e) {
                System.out.println(Jsons.toJson(Map.of("valid", false, "error", e.getMessage())));
                return 2;
            }
            Map<String, Object> effective = Jsons.mapper().convertValue(config, Map.class);
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("valid", true);
            out.put("config", SensitiveDataMasker.masked(effective));
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }
}
