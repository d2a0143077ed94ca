package io.github.yok.flexrecords.db;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import javax.sql.DataSource;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.ArgumentPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;

/**
 * {@link QueryRunner} backed by Spring's {@link JdbcTemplate}.
 *
 * <p>
 * The statement kind is decided from its leading keyword:
 * </p>
 *
 * <ul>
 * <li>{@code SELECT}/{@code WITH}: rows are returned via {@link JdbcTemplate#queryForList}.</li>
 * <li>{@code INSERT}: executed with {@link Statement#RETURN_GENERATED_KEYS}; the generated key
 * (or the generated row, when the driver returns several columns) becomes
 * {@link QueryResult#getInsertId()}.</li>
 * <li>anything else: executed as an update, reporting the affected row count.</li>
 * </ul>
 *
 * <p>
 * Each call borrows a connection from the {@link DataSource}, so the runner is safe to use from the
 * lookup threads of the engine. Transactions are left to the {@link DataSource}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class JdbcQueryRunner implements QueryRunner {

    private final JdbcTemplate jdbcTemplate;

    /**
     * Creates a runner for a data source.
     *
     * @param dataSource data source
     */
    public JdbcQueryRunner(DataSource dataSource) {
        this(new JdbcTemplate(dataSource));
    }

    /**
     * Creates a runner for an existing template.
     *
     * @param jdbcTemplate template
     */
    public JdbcQueryRunner(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public QueryResult query(String sql, List<?> parameters) throws SQLException {
        Object[] args = parameters == null ? new Object[0] : parameters.toArray();
        String keyword = leadingKeyword(sql);
        log.debug("SQL: {} params={}", sql, parameters);
        try {
            if ("SELECT".equals(keyword) || "WITH".equals(keyword)) {
                return QueryResult.ofRows(jdbcTemplate.queryForList(sql, args));
            }
            if ("INSERT".equals(keyword)) {
                KeyHolder keyHolder = new GeneratedKeyHolder();
                int affected = jdbcTemplate.update(con -> {
                    PreparedStatement ps =
                            con.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS);
                    new ArgumentPreparedStatementSetter(args).setValues(ps);
                    return ps;
                }, keyHolder);
                return QueryResult.ofWrite(affected, extractKey(keyHolder));
            }
            return QueryResult.ofWrite(jdbcTemplate.update(sql, args), null);
        } catch (DataAccessException e) {
            Throwable root = e.getMostSpecificCause();
            if (root instanceof SQLException) {
                throw (SQLException) root;
            }
            throw new SQLException(e.getMessage(), e);
        }
    }

    /**
     * Returns the upper-case first keyword of a statement.
     *
     * @param sql statement text
     * @return first keyword, or an empty string
     */
    static String leadingKeyword(String sql) {
        String trimmed = StringUtils.stripStart(StringUtils.defaultString(sql), null);
        int end = 0;
        while (end < trimmed.length() && Character.isLetter(trimmed.charAt(end))) {
            end++;
        }
        return trimmed.substring(0, end).toUpperCase(Locale.ROOT);
    }

    /**
     * Extracts the generated key of the first inserted row.
     *
     * <p>
     * A single generated column is returned as its value. Some drivers (e.g. PostgreSQL) return
     * every column of the inserted row; the whole row is then returned as a column → value map,
     * and the caller picks its identifier column(s) from it.
     * </p>
     *
     * @param keyHolder key holder filled by the insert
     * @return generated value, column → value map, or {@code null} if the store produced none
     */
    static Object extractKey(KeyHolder keyHolder) {
        List<Map<String, Object>> keys = keyHolder.getKeyList();
        if (keys.isEmpty() || keys.get(0).isEmpty()) {
            return null;
        }
        Map<String, Object> first = keys.get(0);
        if (first.size() == 1) {
            return first.values().iterator().next();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(first));
    }
}
