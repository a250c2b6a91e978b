package work.contracts.renderer.cli;

import picocli.CommandLine;
import work.contracts.renderer.config.RenderDefaults;

final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        String implementationVersion = Main.class.getPackage().getImplementationVersion();
        String version = implementationVersion != null ? implementationVersion : "development";
        return new String[] {
            "contract-render (java) " + version,
            "renderer version " + RenderDefaults.load().rendererVersion()
        };
    }
}
