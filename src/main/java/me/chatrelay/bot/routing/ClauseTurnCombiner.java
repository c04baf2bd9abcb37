package me.chatrelay.bot.routing;

import lombok.extern.slf4j.Slf4j;
import me.chatrelay.bot.domain.component.TurnCombinerComponent;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Combines turn fragments clause by clause.
 *
 * <p>
 * Fragments are walked in arrival order:
 * <ul>
 * <li>A bare greeting or closing ("hola", "gracias", "thanks") becomes its own
 * clause; any run of preceding fragments is closed first.</li>
 * <li>A fragment ending in a preposition or article ("busco un médico en")
 * stays open and continues into the next fragment.</li>
 * <li>Any other fragment closes the current run.</li>
 * </ul>
 *
 * <p>
 * Clauses and the fragments inside a run are both joined by a single space, so
 * the output is always the space-joined fragments in arrival order. The clause
 * boundaries are kept for logging.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class ClauseTurnCombiner implements TurnCombinerComponent {

    private static final Set<String> GREETINGS = Set.of(
            "hola", "holi", "buenas", "buen dia", "buen día", "buenos dias", "buenos días",
            "buenas tardes", "buenas noches", "saludos", "gracias", "muchas gracias", "mil gracias",
            "chao", "adios", "adiós", "ok gracias",
            "hi", "hello", "hey", "thanks", "thank you", "bye");

    private static final Set<String> CONNECTORS = Set.of(
            "de", "del", "en", "a", "al", "con", "para", "por", "sin", "sobre", "entre", "hacia",
            "el", "la", "los", "las", "un", "una", "unos", "unas", "y", "o",
            "of", "in", "at", "to", "for", "with", "the", "an", "and", "or");

    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[\\p{Punct}¡¿\\s]+$");
    private static final Pattern LEADING_PUNCTUATION = Pattern.compile("^[\\p{Punct}¡¿\\s]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    @Override
    public String combine(List<String> fragments) {
        if (fragments == null || fragments.isEmpty()) {
            return "";
        }
        if (fragments.size() == 1) {
            return fragments.get(0);
        }

        List<String> clauses = new ArrayList<>();
        StringBuilder run = new StringBuilder();

        for (String fragment : fragments) {
            String text = fragment.trim();
            if (isGreeting(text)) {
                closeRun(run, clauses);
                clauses.add(text);
            } else if (endsWithConnector(text)) {
                appendToRun(run, text);
            } else {
                appendToRun(run, text);
                closeRun(run, clauses);
            }
        }
        closeRun(run, clauses);

        log.debug("[Combiner] {} fragments -> {} clauses", fragments.size(), clauses.size());
        return String.join(" ", clauses);
    }

    boolean isGreeting(String text) {
        String normalized = normalize(text);
        return !normalized.isEmpty() && GREETINGS.contains(normalized);
    }

    boolean endsWithConnector(String text) {
        String normalized = normalize(text);
        if (normalized.isEmpty()) {
            return false;
        }
        String[] words = WHITESPACE.split(normalized);
        return CONNECTORS.contains(words[words.length - 1]);
    }

    private void appendToRun(StringBuilder run, String text) {
        if (run.length() > 0) {
            run.append(' ');
        }
        run.append(text);
    }

    private void closeRun(StringBuilder run, List<String> clauses) {
        if (run.length() > 0) {
            clauses.add(run.toString());
            run.setLength(0);
        }
    }

    private String normalize(String text) {
        String stripped = TRAILING_PUNCTUATION.matcher(text).replaceAll("");
        stripped = LEADING_PUNCTUATION.matcher(stripped).replaceAll("");
        return WHITESPACE.matcher(stripped.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
    }
}
