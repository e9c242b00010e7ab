package com.syncnest.authstarter.utils;

import lombok.RequiredArgsConstructor;
import org.springframework.context.MessageSource;
import org.springframework.context.i18n.LocaleContextHolder;
import org.springframework.stereotype.Component;

/** Resolves message keys for the current request's locale, falling back to the given text. */
@Component
@RequiredArgsConstructor
public class LocalizedMessages {

    private final MessageSource messageSource;

    public String resolve(String key, String fallback) {
        if (key == null) return fallback;
        return messageSource.getMessage(key, null, fallback, LocaleContextHolder.getLocale());
    }
}
