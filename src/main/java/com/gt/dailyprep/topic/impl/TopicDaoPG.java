package com.gt.dailyprep.topic.impl;

import com.gt.dailyprep.exception.DaoException;
import com.gt.dailyprep.model.Topic;
import com.gt.dailyprep.topic.TopicDao;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.*;

public class TopicDaoPG implements TopicDao {

    private static final String LOAD_ALL_TOPICS_SQL =
            "SELECT id, name, create_instant FROM topics ORDER BY LOWER(name), id";

    private static final String LOAD_TOPICS_SQL =
            "SELECT id, name, create_instant FROM topics WHERE id IN (:topicIds) ORDER BY LOWER(name), id";

    private static final String FIND_TOPIC_BY_NAME_SQL =
            "SELECT id, name, create_instant FROM topics WHERE LOWER(name) = LOWER(:name)";

    private static final String CREATE_TOPIC_SQL =
            "INSERT INTO topics (name) VALUES (:name)";

    private static final String DELETE_TOPIC_SQL =
            "DELETE FROM topics WHERE id = :topicId";

    private static final String LOAD_TOPICS_FOR_PROBLEMS_SQL =
            "SELECT pt.problem_id, t.id, t.name, t.create_instant " +
            "FROM problem_topics pt " +
            "JOIN topics t ON t.id = pt.topic_id " +
            "WHERE pt.problem_id IN (:problemIds) " +
            "ORDER BY LOWER(t.name), t.id";

    private static final String DELETE_PROBLEM_TOPICS_SQL =
            "DELETE FROM problem_topics WHERE problem_id = :problemId";

    private static final String INSERT_PROBLEM_TOPIC_SQL =
            "INSERT INTO problem_topics (problem_id, topic_id) VALUES (:problemId, :topicId)";

    private final NamedParameterJdbcTemplate template;

    public TopicDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        this.template = namedParameterJdbcTemplate;
    }

    @Override
    public List<Topic> loadAllTopics() {
        return template.query(LOAD_ALL_TOPICS_SQL, TopicDaoPG::getTopicFromResultSet);
    }

    @Override
    public List<Topic> loadTopics(Collection<Long> topicIds) {
        if (topicIds.isEmpty()) {
            return List.of();
        }

        return template.query(LOAD_TOPICS_SQL, Map.of("topicIds", topicIds), TopicDaoPG::getTopicFromResultSet);
    }

    @Override
    public Topic findTopicByName(String name) {
        List<Topic> topics = template.query(FIND_TOPIC_BY_NAME_SQL, Map.of("name", name), TopicDaoPG::getTopicFromResultSet);

        return topics.isEmpty() ? null : topics.get(0);
    }

    @Override
    public Topic createTopic(String name) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        template.update(CREATE_TOPIC_SQL, new MapSqlParameterSource("name", name), keyHolder, new String[] { "id" });

        Number id = keyHolder.getKey();
        if (id == null) {
            throw new DaoException("No id generated for topic " + name);
        }

        return findTopicByName(name);
    }

    @Override
    public int deleteTopic(long topicId) {
        return template.update(DELETE_TOPIC_SQL, Map.of("topicId", topicId));
    }

    @Override
    public Map<Long, List<Topic>> loadTopicsForProblems(Collection<Long> problemIds) {
        if (problemIds.isEmpty()) {
            return Map.of();
        }

        return template.query(LOAD_TOPICS_FOR_PROBLEMS_SQL, Map.of("problemIds", problemIds), (rs) -> {
            Map<Long, List<Topic>> topicsByProblem = new HashMap<>();

            while (rs.next()) {
                topicsByProblem.computeIfAbsent(rs.getLong("problem_id"), id -> new ArrayList<>())
                        .add(getTopicFromResultSet(rs, 0));
            }

            return topicsByProblem;
        });
    }

    @Override
    public Map<Long, Set<Long>> loadTopicIdsForProblems(Collection<Long> problemIds) {
        Map<Long, Set<Long>> topicIdsByProblem = new HashMap<>();

        for (Map.Entry<Long, List<Topic>> entry : loadTopicsForProblems(problemIds).entrySet()) {
            Set<Long> topicIds = new HashSet<>();
            entry.getValue().forEach(topic -> topicIds.add(topic.id()));

            topicIdsByProblem.put(entry.getKey(), topicIds);
        }

        return topicIdsByProblem;
    }

    @Override
    public void setProblemTopics(long problemId, Collection<Long> topicIds) {
        template.update(DELETE_PROBLEM_TOPICS_SQL, Map.of("problemId", problemId));

        Set<Long> distinctTopicIds = new LinkedHashSet<>(topicIds);
        if (distinctTopicIds.isEmpty()) {
            return;
        }

        int index = 0;
        SqlParameterSource[] sources = new SqlParameterSource[distinctTopicIds.size()];
        for (Long topicId : distinctTopicIds) {
            MapSqlParameterSource source = new MapSqlParameterSource();
            source.addValue("problemId", problemId);
            source.addValue("topicId", topicId);

            sources[index++] = source;
        }

        template.batchUpdate(INSERT_PROBLEM_TOPIC_SQL, sources);
    }

    private static Topic getTopicFromResultSet(ResultSet rs, int rowNum) throws SQLException {
        Timestamp createInstant = rs.getTimestamp("create_instant");

        return new Topic(rs.getLong("id"), rs.getString("name"), createInstant == null ? null : createInstant.toInstant());
    }
}
