package com.fleet.admin.common.enums;

/**
 * 模板中允许出现的占位符，名称大小写不敏感
 */
public enum Placeholder {

    PORT("port"),
    UUID("uuid"),
    SNI("sni", "pool_sni"),
    DOMAIN("domain"),
    REALITY_PRIVATE("reality_private"),
    REALITY_PBK("reality_pbk"),
    REALITY_SID("reality_sid");

    private final String[] names;

    Placeholder(String... names) {
        this.names = names;
    }

    public String primaryName() {
        return names[0];
    }

    public static Placeholder of(String name) {
        if (name == null) {
            return null;
        }
        for (Placeholder placeholder : values()) {
            for (String candidate : placeholder.names) {
                if (candidate.equalsIgnoreCase(name.trim())) {
                    return placeholder;
                }
            }
        }
        return null;
    }
}
