package com.claimrunner.shared.config;

public record StoreConfig(
    Backend backend,
    String file,
    String url,
    String username,
    String password
) {
    public enum Backend {
        FILE, POSTGRES;

        /** Accepts {@code local} and {@code supabase} as aliases. */
        public static Backend parse(String value) {
            var v = value == null ? "" : value.trim().toLowerCase();
            return switch (v) {
                case "file", "local" -> FILE;
                case "postgres", "postgresql", "supabase" -> POSTGRES;
                default -> throw new IllegalArgumentException("Unknown store backend: " + value);
            };
        }
    }

    public static StoreConfig defaults() {
        return new StoreConfig(Backend.FILE, "./sessions.json", "", "", "");
    }

    /** The database URL without user info or parameters, either of which may carry credentials. */
    public String redactedUrl() {
        if (url == null) return "";
        return url.replaceAll("[?;].*$", "").replaceAll("//[^/@]*@", "//");
    }

    @Override
    public String toString() {
        return "StoreConfig[backend=" + backend + ", file=" + file + ", url=" + redactedUrl()
                + ", username=" + username + "]";
    }
}
