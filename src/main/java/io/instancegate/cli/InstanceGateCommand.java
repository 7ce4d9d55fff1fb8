package io.instancegate.cli;

import io.instancegate.config.GatewaySettings;
import io.instancegate.config.InstanceGateConfig;
import io.instancegate.observability.AuditLogger;
import io.instancegate.runtime.GatewayException;
import io.instancegate.runtime.HttpGateway;
import io.instancegate.runtime.InstanceGateRuntime;
import io.instancegate.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

@Command(
        name = "instancegate",
        mixinStandardHelpOptions = true,
        description = "InstanceGate trust-establishment and workload authorization service",
        subcommands = {
                InstanceGateCommand.InitCommand.class,
                InstanceGateCommand.ServeCommand.class,
                InstanceGateCommand.PubkeyCommand.class,
                InstanceGateCommand.InstanceCommand.class,
                InstanceGateCommand.InstancesCommand.class,
                InstanceGateCommand.ResetCommand.class,
                InstanceGateCommand.AuditTailCommand.class,
                InstanceGateCommand.AuditVerifyCommand.class,
                InstanceGateCommand.SchemaMigrationsCommand.class
        }
)
public final class InstanceGateCommand implements Runnable {
    @Option(names = {"--root"}, description = "Data root directory", defaultValue = InstanceGateConfig.DEFAULT_ROOT)
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | serve | pubkey | instance | instances | reset | audit-tail | audit-verify | schema-migrations");
    }

    InstanceGateRuntime runtime() {
        InstanceGateRuntime runtime = new InstanceGateRuntime(InstanceGateConfig.fromRoot(root));
        runtime.init();
        return runtime;
    }

    private static int printFailure(GatewayException e) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("error", e.getMessage());
        out.put("kind", e.kind().auditResult());
        System.err.println(Jsons.toJson(out));
        return 1;
    }

    @Command(name = "init", description = "Initialize directories, instance key and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        InstanceGateCommand parent;

        @Override
        public Integer call() {
            InstanceGateRuntime runtime = parent.runtime();
            System.out.println("Initialized InstanceGate at: " + runtime.config().rootDir()
                    + ", instancePubkey=" + runtime.instancePubkeyHex());
            return 0;
        }
    }

    @Command(name = "serve", description = "Serve the registration and workload HTTP API")
    static final class ServeCommand implements Callable<Integer> {
        @ParentCommand
        InstanceGateCommand parent;

        @Option(names = {"--port"}, description = "Listen port; defaults to the settings file value")
        Integer port;

        @Option(names = {"--host"}, description = "Bind host; defaults to the settings file value")
        String host;

        @Override
        public Integer call() throws Exception {
            InstanceGateConfig config = InstanceGateConfig.fromRoot(parent.root);
            GatewaySettings settings = GatewaySettings.load(config.settingsFile());
            if (port != null) {
                settings = settings.withPort(port);
            }
            if (host != null && !host.isBlank()) {
                settings = settings.withBindHost(host);
            }
            InstanceGateRuntime runtime = new InstanceGateRuntime(config, settings);
            runtime.init();
            HttpGateway gateway = new HttpGateway(runtime, settings.bindHost(), settings.port());
            CountDownLatch stopped = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                gateway.stop();
                stopped.countDown();
            }, "instancegate-shutdown"));
            gateway.start();
            System.out.println("InstanceGate listening on http://" + settings.bindHost() + ":" + gateway.port()
                    + ", instancePubkey=" + runtime.instancePubkeyHex()
                    + ", persistRoot=" + settings.persistRoot());
            stopped.await();
            return 0;
        }
    }

    @Command(name = "pubkey", description = "Print the instance public key")
    static final class PubkeyCommand implements Callable<Integer> {
        @ParentCommand
        InstanceGateCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(Map.of("pubkey", parent.runtime().instancePubkeyHex())));
            return 0;
        }
    }

    @Command(name = "instance", description = "Show the lifecycle record of an instance (default: this instance)")
    static final class InstanceCommand implements Callable<Integer> {
        @ParentCommand
        InstanceGateCommand parent;

        @Parameters(index = "0", arity = "0..1", description = "Instance public key (hex)")
        String pubkey;

        @Override
        public Integer call() {
            InstanceGateRuntime runtime = parent.runtime();
            try {
                String target = pubkey == null || pubkey.isBlank() ? runtime.instancePubkeyHex() : pubkey;
                System.out.println(Jsons.toJson(runtime.getInstance(target)));
                return 0;
            } catch (GatewayException e) {
                return printFailure(e);
            }
        }
    }

    @Command(name = "instances", description = "List stored lifecycle records, most recently updated first")
    static final class InstancesCommand implements Callable<Integer> {
        @ParentCommand
        InstanceGateCommand parent;

        @Option(names = {"--limit"}, defaultValue = "20", description = "Max records to print")
        int limit;

        @Override
        public Integer call() {
            try {
                System.out.println(Jsons.toJson(parent.runtime().listInstances(limit)));
                return 0;
            } catch (GatewayException e) {
                return printFailure(e);
            }
        }
    }

    @Command(name = "reset", description = "Delete a lifecycle record so the instance returns to UNREGISTERED")
    static final class ResetCommand implements Callable<Integer> {
        @ParentCommand
        InstanceGateCommand parent;

        @Option(names = {"--yes"}, defaultValue = "false", description = "Confirm the destructive reset")
        boolean yes;

        @Parameters(index = "0", arity = "0..1", description = "Instance public key (hex); defaults to this instance")
        String pubkey;

        @Override
        public Integer call() {
            if (!yes) {
                System.err.println("Refusing to reset without --yes");
                return 2;
            }
            InstanceGateRuntime runtime = parent.runtime();
            boolean deleted = runtime.reset(pubkey, "cli");
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("instance_pubkey", pubkey == null || pubkey.isBlank() ? runtime.instancePubkeyHex() : pubkey);
            out.put("deleted", deleted);
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "audit-tail", description = "Show latest audit log rows")
    static final class AuditTailCommand implements Callable<Integer> {
        @ParentCommand
        InstanceGateCommand parent;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Number of latest rows")
        int limit;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().auditTail(limit)));
            return 0;
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit hash chain and row signatures")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        InstanceGateCommand parent;

        @Override
        public Integer call() {
            AuditLogger.VerifyOutcome out = parent.runtime().auditVerify();
            System.out.println(Jsons.toJson(out));
            return out.valid() ? 0 : 1;
        }
    }

    @Command(name = "schema-migrations", description = "Show applied schema migration versions")
    static final class SchemaMigrationsCommand implements Callable<Integer> {
        @ParentCommand
        InstanceGateCommand parent;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max rows to print")
        int limit;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().schemaMigrations(limit)));
            return 0;
        }
    }
}
