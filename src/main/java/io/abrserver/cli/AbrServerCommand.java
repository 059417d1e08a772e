package io.abrserver.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.abrserver.config.AbrServerConfig;
import io.abrserver.runtime.AbrServerRuntime;
import io.abrserver.state.BackupStore;
import io.abrserver.state.SchemaValidator;
import io.abrserver.util.Jsons;
import io.abrserver.web.StateHttpServer;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
        name = "abr-server",
        mixinStandardHelpOptions = true,
        description = "ABR visualization state server",
        subcommands = {
                AbrServerCommand.InitCommand.class,
                AbrServerCommand.ServeCommand.class,
                AbrServerCommand.ValidateCommand.class,
                AbrServerCommand.BackupsCommand.class
        }
)
public final class AbrServerCommand implements Runnable {
    @Option(names = {"--root"}, description = "Server data root directory", defaultValue = "data")
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | serve | validate | backups");
    }

    AbrServerRuntime runtime() {
        return new AbrServerRuntime(AbrServerConfig.fromRoot(root));
    }

    @Command(name = "init", description = "Create the data directories")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        AbrServerCommand parent;

        @Override
        public Integer call() {
            try (AbrServerRuntime runtime = parent.runtime()) {
                runtime.init();
                System.out.println("Initialized ABR server at: " + runtime.rootDir());
            }
            return 0;
        }
    }

    @Command(name = "serve", description = "Serve the state API, event stream and asset endpoints over HTTP")
    static final class ServeCommand implements Callable<Integer> {
        @ParentCommand
        AbrServerCommand parent;

        @Option(names = {"--bind"}, defaultValue = "0.0.0.0", description = "Bind host")
        String bind;

        @Option(names = {"--port"}, defaultValue = "8000", description = "Bind port")
        int port;

        @Override
        public Integer call() throws Exception {
            AbrServerRuntime runtime = parent.runtime();
            runtime.init();
            StateHttpServer server = new StateHttpServer(runtime, new InetSocketAddress(bind, port));
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                server.close();
                runtime.close();
            }, "abr-shutdown"));
            server.start();
            System.out.println("ABR server listening on http://" + bind + ":" + server.port()
                    + "/, root=" + runtime.rootDir()
                    + ", downloads=" + (runtime.settings().downloadAssets() ? "on" : "off"));
            Thread.currentThread().join();
            return 0;
        }
    }

    @Command(name = "validate", description = "Validate a state document against the state schema")
    static final class ValidateCommand implements Callable<Integer> {
        @ParentCommand
        AbrServerCommand parent;

        @Parameters(index = "0", description = "State JSON file")
        Path file;

        @Override
        public Integer call() {
            try (AbrServerRuntime runtime = parent.runtime()) {
                JsonNode document;
                try {
                    document = Jsons.parse(Files.readString(file, StandardCharsets.UTF_8));
                } catch (IOException e) {
                    throw new RuntimeException("Failed to read " + file, e);
                }
                List<SchemaValidator.Violation> violations = runtime.stateSchema().validate(document);
                if (violations.isEmpty()) {
                    System.out.println("valid: " + file);
                    return 0;
                }
                violations.forEach(v -> System.out.println("invalid: " + v));
                return 2;
            }
        }
    }

    @Command(name = "backups", description = "List retained state backups, newest last")
    static final class BackupsCommand implements Callable<Integer> {
        @ParentCommand
        AbrServerCommand parent;

        @Option(names = {"--latest"}, defaultValue = "false", description = "Print only the newest snapshot document")
        boolean latest;

        @Override
        public Integer call() {
            try (AbrServerRuntime runtime = parent.runtime()) {
                BackupStore backups = runtime.backups();
                if (latest) {
                    System.out.println(backups.latest()
                            .map(entry -> Jsons.toJson(entry.document()))
                            .orElse("null"));
                    return 0;
                }
                ArrayNode out = Jsons.mapper().createArrayNode();
                for (BackupStore.BackupEntry entry : backups.entries()) {
                    ObjectNode item = out.addObject();
                    item.put("takenAt", entry.takenAt().toString());
                    item.set("version", entry.document().path("version").deepCopy());
                    item.put("topLevelKeys", entry.document().size());
                }
                System.out.println(Jsons.toJson(out));
                return 0;
            }
        }
    }
}
