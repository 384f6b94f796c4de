package io.taskhooks.core.model;

/** Name and version of this tool, stamped into events and audit records. */
public final class ToolInfo {

    public static final String NAME = "taskhooks";

    private static final String VERSION = resolveVersion();

    private ToolInfo() {}

    public static String version() {
        return VERSION;
    }

    private static String resolveVersion() {
        String version = ToolInfo.class.getPackage().getImplementationVersion();
        return version != null ? version : "dev";
    }
}
