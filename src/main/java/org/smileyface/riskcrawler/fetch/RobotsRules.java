package org.smileyface.riskcrawler.fetch;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Allow/disallow rules of the {@code User-agent: *} groups of a robots.txt. The longest matching
 * rule wins; on equal length, allow wins.
 */
public class RobotsRules {

    private final List<Rule> rules;

    public RobotsRules(List<Rule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static RobotsRules allowAll() {
        return new RobotsRules(List.of());
    }

    public static RobotsRules disallowAll() {
        return new RobotsRules(List.of(new Rule("/", false)));
    }

    public boolean isAllowed(String pathAndQuery) {
        if (rules.isEmpty()) return true;
        String subject = pathAndQuery == null || pathAndQuery.isBlank() ? "/" : pathAndQuery;
        Rule best = null;
        for (Rule rule : rules) {
            if (!rule.matches(subject)) continue;
            if (best == null
                    || rule.path().length() > best.path().length()
                    || (rule.path().length() == best.path().length() && rule.allow() && !best.allow())) {
                best = rule;
            }
        }
        return best == null || best.allow();
    }

    public static RobotsRules parse(String robotsText) {
        if (robotsText == null || robotsText.isBlank()) return allowAll();

        List<Rule> parsed = new ArrayList<>();
        boolean groupApplies = false;
        boolean inAgentLines = false;
        for (String rawLine : robotsText.split("\\R")) {
            int hash = rawLine.indexOf('#');
            String line = (hash >= 0 ? rawLine.substring(0, hash) : rawLine).trim();
            if (line.isEmpty()) continue;
            int colon = line.indexOf(':');
            if (colon <= 0) continue;
            String key = line.substring(0, colon).trim().toLowerCase(Locale.ROOT);
            String value = line.substring(colon + 1).trim();

            if ("user-agent".equals(key)) {
                // consecutive user-agent lines share one group
                if (!inAgentLines) groupApplies = false;
                groupApplies |= "*".equals(value);
                inAgentLines = true;
                continue;
            }
            inAgentLines = false;
            if (groupApplies && ("allow".equals(key) || "disallow".equals(key)) && !value.isBlank()) {
                parsed.add(new Rule(value, "allow".equals(key)));
            }
        }
        return new RobotsRules(parsed);
    }

    public record Rule(String path, boolean allow) {

        public boolean matches(String subject) {
            String p = path.startsWith("/") ? path : "/" + path;
            if (p.indexOf('*') < 0 && p.indexOf('$') < 0) {
                return subject.startsWith(p);
            }
            StringBuilder regex = new StringBuilder("^");
            for (char c : p.toCharArray()) {
                if (c == '*') regex.append(".*");
                else if (c == '$') regex.append('$');
                else regex.append(Pattern.quote(Character.toString(c)));
            }
            return Pattern.compile(regex.toString()).matcher(subject).find();
        }
    }
}
