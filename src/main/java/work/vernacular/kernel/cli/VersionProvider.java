package work.vernacular.kernel.cli;

import picocli.CommandLine;
import work.vernacular.kernel.core.BuiltinCommandExecutor;

/**
 * Reports the jar's implementation version, the size of the built-in command table and the running JVM.
 */
final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        Package pkg = Main.class.getPackage();
        String version = pkg.getImplementationVersion() != null ? pkg.getImplementationVersion() : "development";
        int commands = BuiltinCommandExecutor.create().registry().entries().size();
        return new String[] {
            "vernacular-run (java) " + version,
            "built-in commands: " + commands,
            "runtime: Java " + Runtime.version() + " (" + System.getProperty("java.vendor", "unknown vendor") + ")"
        };
    }
}
