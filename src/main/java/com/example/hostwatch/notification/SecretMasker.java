package com.example.hostwatch.notification;

import com.example.hostwatch.config.MonitorProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Replaces secrets in outbound text with {@value #MASK}: the configured Slack token and
 * webhook URL verbatim, plus anything shaped like a token.
 */
@Component
public class SecretMasker {

    public static final String MASK = "***";

    private static final List<Replacement> PATTERNS = List.of(
            new Replacement(Pattern.compile("https://hooks\\.slack\\.com/services/[A-Za-z0-9/_-]+"),
                    "https://hooks.slack.com/services/" + MASK),
            new Replacement(Pattern.compile("xox[abposre]-[A-Za-z0-9-]+"), MASK),
            new Replacement(Pattern.compile("(?i)\\bbearer\\s+[A-Za-z0-9._~+/=-]+"), "Bearer " + MASK),
            new Replacement(Pattern.compile("(?i)\\b(token|password|passwd|secret|api[_-]?key)(\\s*[=:]\\s*)[^\\s,;&\"']+"),
                    "$1$2" + MASK));

    private final List<String> literals;

    @Autowired
    public SecretMasker(MonitorProperties properties) {
        this(secretsFrom(properties));
    }

    SecretMasker(List<String> literals) {
        List<String> cleaned = new ArrayList<>();
        for (String literal : literals) {
            if (literal != null && !literal.isBlank()) {
                cleaned.add(literal);
            }
        }
        // longest first so a secret containing another is replaced whole
        cleaned.sort(Comparator.comparingInt(String::length).reversed());
        this.literals = List.copyOf(cleaned);
    }

    public String mask(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String result = text;
        for (String literal : literals) {
            result = result.replace(literal, MASK);
        }
        for (Replacement replacement : PATTERNS) {
            result = replacement.pattern().matcher(result).replaceAll(replacement.with());
        }
        return result;
    }

    private static List<String> secretsFrom(MonitorProperties properties) {
        MonitorProperties.NotificationConfig.SlackConfig slack = properties.getNotifications().getSlack();
        List<String> secrets = new ArrayList<>();
        secrets.add(slack.getToken());
        secrets.add(slack.getWebhookUrl());
        return secrets;
    }

    private record Replacement(Pattern pattern, String with) {
    }
}
