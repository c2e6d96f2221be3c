package work.lcod.versioner.cli;

import picocli.CommandLine;

/**
 * Reads the version from the jar manifest; unpackaged builds report {@code development}.
 */
final class VersionProvider implements CommandLine.IVersionProvider {
    static final String TOOL_NAME = "extension-versioner";

    @Override
    public String[] getVersion() {
        Package pkg = Main.class.getPackage();
        String version = pkg.getImplementationVersion() != null ? pkg.getImplementationVersion() : "development";
        return new String[] {
            TOOL_NAME + " " + version,
            "Java " + System.getProperty("java.version") + " (" + System.getProperty("java.vendor") + ")"
        };
    }
}
