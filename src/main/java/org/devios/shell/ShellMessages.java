package org.devios.shell;

import org.devios.shell.session.Language;
import org.springframework.context.MessageSource;

import java.time.Clock;
import java.time.format.DateTimeFormatter;

/**
 * 按会话语言取提示文本（{@code messages.properties} / {@code messages_zh_TW.properties}）。
 * <p>
 * 带参数的文本会经过 {@link java.text.MessageFormat}，参数请统一传字符串，避免数字被格式化成 1,000。
 */
public class ShellMessages {

    private final MessageSource messageSource;

    public ShellMessages(MessageSource messageSource) {
        this.messageSource = messageSource;
    }

    public String get(Language language, String code, Object... args) {
        return messageSource.getMessage(code, args.length == 0 ? null : args, language.locale());
    }

    /**
     * 按语言的本地日期格式（{@code date.pattern}）格式化时钟的当前时间。
     */
    public String now(Language language, Clock clock) {
        DateTimeFormatter formatter = DateTimeFormatter.ofPattern(get(language, "date.pattern"), language.locale())
                .withZone(clock.getZone());
        return formatter.format(clock.instant());
    }
}
