package com.fatec.rag_compliance.repository;

import com.fatec.rag_compliance.exception.RuleStoreUnavailableException;
import com.fatec.rag_compliance.model.Rule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

@Repository
public class JdbcRuleStore implements RuleStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcRuleStore.class);

    private static final String SELECT_RULES = """
            SELECT id,
                   name,
                   content,
                   category
            FROM rubrics
            ORDER BY id
            LIMIT ?
            """;

    private final JdbcTemplate jdbcTemplate;

    public JdbcRuleStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<Rule> fetchRules(int limit) {
        try {
            List<Rule> rules = jdbcTemplate.query(SELECT_RULES, new RuleRowMapper(), limit);
            log.debug("Fetched {} rules from rubrics table", rules.size());
            return rules;
        } catch (DataAccessException e) {
            throw new RuleStoreUnavailableException("Failed to load rules from database", e);
        }
    }

    private static class RuleRowMapper implements RowMapper<Rule> {
        @Override
        public Rule mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new Rule(
                    rs.getLong("id"),
                    rs.getString("name"),
                    rs.getString("content"),
                    rs.getString("category"));
        }
    }
}
