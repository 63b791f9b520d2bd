package org.retroscript.compiler.diagnostics;

import org.retroscript.compiler.frontend.lexer.Lexer;
import org.retroscript.compiler.frontend.semantics.BuiltinSignatures;
import org.retroscript.compiler.model.Span;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Suggests text edits for common syntax errors: typos of keywords and built-ins, and
 * missing semicolons, braces, colons and quotes. Fixes are matched by diagnostic message.
 */
public class QuickFixProvider {

    private static final int MAX_SUGGESTIONS = 3;
    private static final int MAX_DISTANCE = 2;

    private record FixPattern(Pattern pattern, BiFunction<Matcher, Context, List<QuickFix>> fixer) {
    }

    private record Context(Diagnostic diagnostic, String sourceLine) {
    }

    private final Set<String> vocabulary;
    private final List<FixPattern> patterns = new ArrayList<>();

    public QuickFixProvider() {
        this(defaultVocabulary());
    }

    public QuickFixProvider(Set<String> vocabulary) {
        this.vocabulary = vocabulary;
        patterns.add(new FixPattern(Pattern.compile("Unexpected token '(\\w+)'"), this::fixTypo));
        patterns.add(new FixPattern(Pattern.compile("Expected (?:expression|declaration), got '(\\w+)'"), this::fixTypo));
        patterns.add(new FixPattern(Pattern.compile("Expected ';'"), QuickFixProvider::fixMissingSemicolon));
        patterns.add(new FixPattern(Pattern.compile("Expected '}'"), QuickFixProvider::fixMissingBrace));
        patterns.add(new FixPattern(Pattern.compile("Expected ':'"), QuickFixProvider::fixMissingColon));
        patterns.add(new FixPattern(Pattern.compile("Unterminated string"), QuickFixProvider::fixUnterminatedString));
    }

    /**
     * Returns the fixes that apply to a diagnostic.
     *
     * @param diagnostic the diagnostic to fix
     * @param sourceLine the text of the line the diagnostic starts on, may be empty
     * @return applicable fixes, possibly empty
     */
    public List<QuickFix> getFixes(Diagnostic diagnostic, String sourceLine) {
        Context context = new Context(diagnostic, sourceLine == null ? "" : sourceLine);
        List<QuickFix> fixes = new ArrayList<>();
        for (FixPattern pattern : patterns) {
            Matcher matcher = pattern.pattern().matcher(diagnostic.message());
            if (matcher.find()) {
                fixes.addAll(pattern.fixer().apply(matcher, context));
            }
        }
        return fixes;
    }

    /**
     * Returns keywords and built-in names close to {@code word}, nearest first.
     */
    public List<String> suggest(String word) {
        String lower = word.toLowerCase();
        return vocabulary.stream()
                .filter(candidate -> !candidate.equals(lower))
                .filter(candidate -> distance(lower, candidate) <= MAX_DISTANCE)
                .sorted(Comparator.comparingInt((String candidate) -> distance(lower, candidate))
                        .thenComparing(Comparator.naturalOrder()))
                .limit(MAX_SUGGESTIONS)
                .toList();
    }

    private List<QuickFix> fixTypo(Matcher matcher, Context context) {
        String word = matcher.group(1);
        Span span = context.diagnostic().span();
        Span target = new Span(span.startLine(), span.startColumn(), span.startLine(), span.startColumn() + word.length());
        return suggest(word).stream()
                .map(candidate -> QuickFix.replace("Replace with '" + candidate + "'", candidate, target))
                .toList();
    }

    private static List<QuickFix> fixMissingSemicolon(Matcher matcher, Context context) {
        Span span = context.diagnostic().span();
        Span insertAt = new Span(span.startLine(), span.startColumn(), span.startLine(), span.startColumn());
        return List.of(QuickFix.replace("Insert ';'", ";", insertAt));
    }

    private static List<QuickFix> fixMissingBrace(Matcher matcher, Context context) {
        Span insertAt = endOfLine(context);
        return List.of(QuickFix.replace("Add closing '}'", "\n}", insertAt));
    }

    private static List<QuickFix> fixMissingColon(Matcher matcher, Context context) {
        Span span = context.diagnostic().span();
        Span insertAt = new Span(span.startLine(), span.startColumn(), span.startLine(), span.startColumn());
        return List.of(QuickFix.replace("Insert ':'", ":", insertAt));
    }

    private static List<QuickFix> fixUnterminatedString(Matcher matcher, Context context) {
        String line = context.sourceLine();
        char quote = line.lastIndexOf('\'') > line.lastIndexOf('"') ? '\'' : '"';
        return List.of(QuickFix.replace("Close string", String.valueOf(quote), endOfLine(context)));
    }

    private static Span endOfLine(Context context) {
        int line = context.diagnostic().span().startLine();
        int column = context.sourceLine().stripTrailing().length() + 1;
        return new Span(line, column, line, column);
    }

    private static Set<String> defaultVocabulary() {
        Set<String> words = new LinkedHashSet<>(Lexer.keywords());
        words.addAll(BuiltinSignatures.names());
        return words;
    }

    /**
     * Levenshtein edit distance.
     */
    static int distance(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}
