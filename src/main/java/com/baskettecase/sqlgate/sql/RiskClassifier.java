package com.baskettecase.sqlgate.sql;

import lombok.extern.slf4j.Slf4j;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.schema.Table;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.delete.Delete;
import net.sf.jsqlparser.statement.select.AllColumns;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.SelectItem;
import net.sf.jsqlparser.statement.update.Update;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Risk Classifier
 *
 * Sorts query text into a risk category with ordered pattern checks: injection, then DDL, then
 * unscoped mutations and whole-table reads, then performance. The first matching tier wins.
 * Single statements are also parsed with JSQLParser to tell scoped from unscoped
 * DELETE/UPDATE/SELECT *; text the parser rejects is judged by the patterns alone.
 *
 * This is a heuristic. It has no state and is safe to share between threads.
 *
 * @see <a href="https://github.com/JSQLParser/JSqlParser">JSQLParser Documentation</a>
 */
@Slf4j
@Component
public class RiskClassifier {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE;

    private static final List<Pattern> INJECTION_PATTERNS = List.of(
        Pattern.compile("'.*\\s+OR\\s+.*='", FLAGS),
        Pattern.compile("'.*;\\s*DROP\\s+TABLE\\s+", FLAGS),
        Pattern.compile("'.*UNION\\s+SELECT\\s+", FLAGS),
        Pattern.compile("--"),
        Pattern.compile("/\\*.*\\*/", FLAGS | Pattern.DOTALL)
    );

    private static final List<Pattern> DDL_PATTERNS = List.of(
        Pattern.compile("\\bDROP\\s+(?:TABLE|DATABASE|SCHEMA|INDEX)\\s+\\w+", FLAGS),
        Pattern.compile("\\bCREATE\\s+(?:TABLE|DATABASE|SCHEMA|INDEX)\\s+\\w+", FLAGS),
        Pattern.compile("\\bALTER\\s+TABLE\\s+\\w+\\s+(?:ADD|DROP|MODIFY)", FLAGS),
        Pattern.compile("\\bTRUNCATE\\s+TABLE\\s+\\w+", FLAGS)
    );

    private static final List<Pattern> UNSCOPED_PATTERNS = List.of(
        Pattern.compile("\\bDELETE\\s+FROM\\s+\\w+\\s*(?:;|$)", FLAGS),
        Pattern.compile("\\bUPDATE\\s+\\w+\\s+SET\\s+(?:(?!\\bWHERE\\b).)*(?:;|$)", FLAGS | Pattern.DOTALL),
        Pattern.compile("\\bSELECT\\s+\\*\\s+FROM\\s+\\w+\\s*(?:;|$)", FLAGS)
    );

    private static final List<Pattern> PERFORMANCE_PATTERNS = List.of(
        Pattern.compile("\\bSELECT\\s+.*\\bFROM\\s+\\w+\\s+(?:\\w+\\s+)?JOIN\\s+.*JOIN\\s+.*JOIN", FLAGS),
        Pattern.compile("\\bORDER\\s+BY\\s+\\w+\\s+DESC\\s+LIMIT\\s+\\d{4,}", FLAGS),
        Pattern.compile("\\bLIKE\\s+['\"]%.*%['\"]", FLAGS),
        Pattern.compile("\\bCROSS\\s+JOIN\\b", FLAGS)
    );

    // Semicolon outside string literals, after trailing ones are stripped
    private static final Pattern MULTI_STATEMENT_PATTERN = Pattern.compile(
        ";(?=(?:[^']*'[^']*')*[^']*$)"
    );

    private static final Pattern TRAILING_SEMICOLONS = Pattern.compile("[;\\s]+$");

    public RiskAssessment classify(String queryText) {
        if (queryText == null || queryText.isBlank()) {
            return RiskAssessment.SAFE;
        }

        Optional<RiskAssessment> risk = firstMatch(RiskCategory.SQL_INJECTION, INJECTION_PATTERNS, queryText)
            .or(() -> firstMatch(RiskCategory.DDL, DDL_PATTERNS, queryText))
            .or(() -> unscoped(queryText))
            .or(() -> firstMatch(RiskCategory.PERFORMANCE, PERFORMANCE_PATTERNS, queryText));

        if (risk.isPresent()) {
            log.debug("⚠️ Query classified as {}: {}", risk.get().category().wireValue(), risk.get().reason());
            return risk.get();
        }
        return RiskAssessment.SAFE;
    }

    private static Optional<RiskAssessment> firstMatch(RiskCategory category, List<Pattern> patterns, String sql) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(sql).find()) {
                return Optional.of(RiskAssessment.risky(category, "matched " + pattern.pattern()));
            }
        }
        return Optional.empty();
    }

    private static Optional<RiskAssessment> unscoped(String sql) {
        String trimmed = TRAILING_SEMICOLONS.matcher(sql.trim()).replaceAll("");
        if (MULTI_STATEMENT_PATTERN.matcher(trimmed).find()) {
            return firstMatch(RiskCategory.UNSCOPED_MUTATION, UNSCOPED_PATTERNS, sql);
        }

        Statement statement;
        try {
            statement = CCJSqlParserUtil.parse(trimmed);
        } catch (JSQLParserException e) {
            log.debug("Could not parse query, using patterns only: {}", e.getMessage());
            return firstMatch(RiskCategory.UNSCOPED_MUTATION, UNSCOPED_PATTERNS, sql);
        }

        String reason = null;
        if (statement instanceof Delete && ((Delete) statement).getWhere() == null) {
            reason = "DELETE without WHERE";
        } else if (statement instanceof Update && ((Update) statement).getWhere() == null) {
            reason = "UPDATE without WHERE";
        } else if (statement instanceof PlainSelect && isWholeTableRead((PlainSelect) statement)) {
            reason = "SELECT * without WHERE or LIMIT";
        }
        return reason == null
            ? Optional.empty()
            : Optional.of(RiskAssessment.risky(RiskCategory.UNSCOPED_MUTATION, reason));
    }

    private static boolean isWholeTableRead(PlainSelect select) {
        List<SelectItem<?>> items = select.getSelectItems();
        boolean allColumns = items != null && !items.isEmpty()
            && items.stream().allMatch(item -> item.getExpression() instanceof AllColumns);

        return allColumns
            && select.getFromItem() instanceof Table
            && (select.getJoins() == null || select.getJoins().isEmpty())
            && select.getWhere() == null
            && select.getLimit() == null
            && select.getFetch() == null
            && select.getTop() == null;
    }
}
