package org.devios.shell.session;

import java.util.Locale;

/**
 * 会话语言。决定提示文本（MessageSource）与文件内容版本。
 */
public enum Language {
    ZH_TW("zh_TW", "zh", Locale.TRADITIONAL_CHINESE),
    EN_US("en_US", "en", Locale.US);

    /**
     * 文件内容缺少某语言版本时回退到的语言。
     */
    public static final Language PRIMARY = ZH_TW;

    private final String tag;
    private final String shortName;
    private final Locale locale;

    Language(String tag, String shortName, Locale locale) {
        this.tag = tag;
        this.shortName = shortName;
        this.locale = locale;
    }

    public String tag() {
        return tag;
    }

    public String shortName() {
        return shortName;
    }

    public Locale locale() {
        return locale;
    }

    /**
     * 按 tag（zh_TW / en_US）解析，大小写与 {@code -}/{@code _} 不敏感。
     */
    public static Language fromTag(String tag) {
        if (tag != null) {
            String normalized = tag.trim().replace('-', '_');
            for (Language language : values()) {
                if (language.tag.equalsIgnoreCase(normalized)) {
                    return language;
                }
            }
        }
        throw new IllegalArgumentException("不支持的语言：" + tag);
    }

    /**
     * 按 {@code lang} 命令的参数（zh / en）解析；无法识别返回 null。
     */
    public static Language fromShortName(String name) {
        for (Language language : values()) {
            if (language.shortName.equalsIgnoreCase(name)) {
                return language;
            }
        }
        return null;
    }
}
