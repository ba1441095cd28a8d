package com.gt.dailyprep.selection;

import com.gt.dailyprep.model.Problem;
import com.gt.dailyprep.topic.TopicDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Picks problems from a pool at random while keeping any single topic from appearing more than a set number of
 * times. If the cap leaves slots empty they are filled from the same shuffled order without it, so a pool with
 * enough members always yields the requested count.
 */
@Component
public class DiversitySampler {

    private static final Logger log = LoggerFactory.getLogger(DiversitySampler.class);

    private final TopicDao topicDao;
    private final Random random;
    private final int maxPerTopic;

    public DiversitySampler(TopicDao topicDao,
                            Random random,
                            @Value("${dailyprep.selection.maxPerTopic:2}") int maxPerTopic) {
        this.topicDao = topicDao;
        this.random = random;
        this.maxPerTopic = maxPerTopic;
    }

    public List<Problem> sample(List<Problem> pool, int count) {
        return sample(pool, count, maxPerTopic);
    }

    public List<Problem> sample(List<Problem> pool, int count, int maxPerTopic) {
        if (pool.isEmpty() || count <= 0) {
            return List.of();
        }
        if (count >= pool.size()) {
            return new ArrayList<>(pool);
        }

        Map<Long, Set<Long>> topicIdsByProblem = topicDao.loadTopicIdsForProblems(pool.stream().map(Problem::id).toList());

        return sample(pool, count, maxPerTopic, topicIdsByProblem);
    }

    List<Problem> sample(List<Problem> pool, int count, int maxPerTopic, Map<Long, Set<Long>> topicIdsByProblem) {
        if (pool.isEmpty() || count <= 0) {
            return List.of();
        }
        if (count >= pool.size()) {
            return new ArrayList<>(pool);
        }

        List<Problem> shuffled = new ArrayList<>(pool);
        Collections.shuffle(shuffled, random);

        List<Problem> accepted = new ArrayList<>(count);
        Set<Long> acceptedIds = new HashSet<>();
        Map<Long, Integer> topicCounts = new HashMap<>();

        for (Problem problem : shuffled) {
            if (accepted.size() >= count) {
                break;
            }

            Set<Long> topicIds = topicIdsByProblem.getOrDefault(problem.id(), Set.of());
            boolean withinCap = topicIds.stream().allMatch(topicId -> topicCounts.getOrDefault(topicId, 0) < maxPerTopic);

            if (withinCap) {
                accepted.add(problem);
                acceptedIds.add(problem.id());
                topicIds.forEach(topicId -> topicCounts.merge(topicId, 1, Integer::sum));
            }
        }

        if (accepted.size() < count) {
            log.debug("Topic cap of {} left {} of {} slots open, filling without the cap", maxPerTopic, count - accepted.size(), count);

            for (Problem problem : shuffled) {
                if (accepted.size() >= count) {
                    break;
                }
                if (acceptedIds.add(problem.id())) {
                    accepted.add(problem);
                }
            }
        }

        return accepted;
    }
}
