package work.packhost.kernel.cli;

import com.fasterxml.jackson.databind.ObjectWriter;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.packhost.kernel.api.HostConfiguration;
import work.packhost.kernel.api.HostConfigurationLoader;
import work.packhost.kernel.api.PackHost;
import work.packhost.kernel.api.Result;
import work.packhost.kernel.install.ChecksumVerifier;
import work.packhost.kernel.install.PackNaming;
import work.packhost.kernel.pack.InstallSource;
import work.packhost.kernel.pack.Pack;
import work.packhost.kernel.shared.DurationParser;
import work.packhost.kernel.shared.Json;

@CommandLine.Command(
    name = "packhost",
    description = "Install packs and run them inside the capability sandbox.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    subcommands = {
        PackHostCommand.InstallCommand.class,
        PackHostCommand.RunCommand.class,
        PackHostCommand.ChecksumCommand.class
    }
)
final class PackHostCommand implements Callable<Integer> {
    private static final ObjectWriter JSON_WRITER = Json.prettyWriter();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    static final class HostOptions {
        @CommandLine.Option(
            names = "--config",
            description = "Host configuration file (TOML).",
            defaultValue = CommandLine.Option.NULL_VALUE
        )
        private Path config;

        @CommandLine.Option(
            names = "--data-dir",
            description = "Data directory (overrides [storage].data_dir).",
            defaultValue = CommandLine.Option.NULL_VALUE
        )
        private Path dataDir;

        HostConfiguration resolve() {
            Path file = config;
            if (file == null) {
                var candidate = Paths.get(HostConfigurationLoader.DEFAULT_FILE_NAME).toAbsolutePath();
                file = Files.isRegularFile(candidate) ? candidate : null;
            }
            HostConfiguration loaded = file != null
                ? HostConfigurationLoader.load(file)
                : HostConfiguration.defaults(Path.of(System.getProperty("user.home"), ".packhost"));
            if (dataDir == null) {
                return loaded;
            }
            return HostConfiguration.builder()
                .dataDirectory(dataDir)
                .kvBackend(loaded.kvBackend())
                .transitionTimeout(loaded.transitionTimeout())
                .httpTimeout(loaded.httpTimeout())
                .downloadTimeout(loaded.downloadTimeout())
                .inheritStdout(loaded.inheritStdout())
                .inheritStderr(loaded.inheritStderr())
                .enforcePackNaming(loaded.enforcePackNaming())
                .archiveLimits(loaded.archiveLimits())
                .entryFunction(loaded.entryFunction())
                .workerThreads(loaded.workerThreads())
                .build();
        }
    }

    static final class SourceOptions {
        @CommandLine.Parameters(index = "0", paramLabel = "ARCHIVE", description = "Archive path or HTTP(S) URL.")
        private String archive;

        @CommandLine.Option(names = "--checksum", description = "Expected SHA-256 of the archive (hex).")
        private String checksum;

        @CommandLine.Option(names = "--prod", description = "Production install; requires --checksum.")
        private boolean prod;

        Result<Pack> install(PackHost host) {
            boolean remote = archive.startsWith("http://") || archive.startsWith("https://");
            if (remote) {
                var fileName = PackNaming.fileNameOf(archive);
                var source = prod ? InstallSource.prod(fileName, archive) : InstallSource.dev(fileName, archive);
                return host.installFromUrl(archive, source, checksum);
            }
            var path = Paths.get(archive).toAbsolutePath().normalize();
            var fileName = String.valueOf(path.getFileName());
            var source = prod ? InstallSource.prod(fileName, path.toString()) : InstallSource.dev(fileName, path.toString());
            return host.installFromFile(path, source, checksum);
        }
    }

    @CommandLine.Command(name = "install", description = "Install a pack archive and print the installed pack.", mixinStandardHelpOptions = true)
    static final class InstallCommand implements Callable<Integer> {
        @CommandLine.Mixin
        private SourceOptions source;

        @CommandLine.Mixin
        private HostOptions hostOptions;

        @CommandLine.Spec
        private CommandLine.Model.CommandSpec spec;

        @Override
        public Integer call() throws Exception {
            try (var host = PackHost.create(hostOptions.resolve())) {
                var result = source.install(host);
                print(spec, result.toPrettyJson());
                return result.status().exitCode();
            }
        }
    }

    @CommandLine.Command(name = "run", description = "Install a pack, start one instance and wait for it to finish.", mixinStandardHelpOptions = true)
    static final class RunCommand implements Callable<Integer> {
        @CommandLine.Mixin
        private SourceOptions source;

        @CommandLine.Mixin
        private HostOptions hostOptions;

        @CommandLine.Option(names = {"-e", "--env"}, description = "Environment variable passed to the pack (NAME=VALUE).")
        private Map<String, String> env = new LinkedHashMap<>();

        @CommandLine.Option(names = "--timeout", description = "Maximum run time (e.g. 30s, 2m).", defaultValue = "5m")
        private String timeoutRaw;

        @CommandLine.Spec
        private CommandLine.Model.CommandSpec spec;

        @Override
        public Integer call() throws Exception {
            Duration timeout;
            try {
                timeout = DurationParser.parseOrDefault(timeoutRaw, Duration.ofMinutes(5));
            } catch (IllegalArgumentException ex) {
                throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage());
            }
            try (var host = PackHost.create(hostOptions.resolve())) {
                var installed = source.install(host);
                if (installed.isFailure()) {
                    print(spec, installed.toPrettyJson());
                    return installed.status().exitCode();
                }
                var pack = installed.value();
                var outcome = host.createInstance(pack.id(), pack.name())
                    .flatMap(instance -> host.startInstance(instance.id(), env))
                    .flatMap(instance -> host.awaitIdle(instance.id(), timeout));
                if (outcome.isFailure()) {
                    print(spec, outcome.toPrettyJson());
                    return outcome.status().exitCode();
                }
                var instance = outcome.value();
                var report = new LinkedHashMap<String, Object>();
                report.put("pack", pack.id());
                report.put("instance", instance);
                report.put("history", host.executionHistory(instance.id()));
                print(spec, JSON_WRITER.writeValueAsString(report));
                if (instance.isRunning()) {
                    return 1;
                }
                return instance.lastExitCode() == null ? 0 : instance.lastExitCode();
            }
        }
    }

    @CommandLine.Command(name = "checksum", description = "Print the SHA-256 of a file.", mixinStandardHelpOptions = true)
    static final class ChecksumCommand implements Callable<Integer> {
        @CommandLine.Parameters(index = "0", paramLabel = "FILE")
        private Path file;

        @CommandLine.Option(names = "--expect", description = "Fail unless the digest equals this value.")
        private String expected;

        @CommandLine.Spec
        private CommandLine.Model.CommandSpec spec;

        @Override
        public Integer call() {
            if (expected != null) {
                var actual = ChecksumVerifier.verify(file, expected);
                print(spec, actual + "  " + file.getFileName());
                return 0;
            }
            print(spec, ChecksumVerifier.sha256(file) + "  " + file.getFileName());
            return 0;
        }
    }

    private static void print(CommandLine.Model.CommandSpec spec, String text) {
        PrintWriter out = spec.commandLine().getOut();
        out.println(text);
        out.flush();
    }
}
