package io.relay.cli;

import io.relay.core.config.RelayRuntime;
import io.relay.core.provider.ProviderProfile;
import io.relay.core.provider.ProviderRouter;
import java.util.Locale;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "providers", description = "List configured provider profiles")
public final class ProvidersCommand implements Callable<Integer> {
    private final CliContext context;

    public ProvidersCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try (RelayRuntime runtime = context.openRuntime()) {
            ProviderRouter router = runtime.router();
            System.out.println("Config path: " + context.configPath());
            for (ProviderProfile profile : router.profiles()) {
                String credential = router.credentialResolves(profile) ? "ok" : "missing";
                System.out.printf(
                    "%-20s %-10s %-24s weight=%-3d model=%s credential=%s%n",
                    profile.name(),
                    profile.kind().name().toLowerCase(Locale.ROOT),
                    profile.api().id(),
                    profile.weight(),
                    profile.model().isBlank() ? "-" : profile.model(),
                    credential
                );
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Providers command failed: " + e.getMessage());
            return 1;
        }
    }
}
