package com.gt.dailyprep.selection;

import com.gt.dailyprep.model.MasteryState;
import com.gt.dailyprep.model.Problem;
import com.gt.dailyprep.topic.TopicDao;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.util.*;
import java.util.stream.Collectors;

import static com.gt.dailyprep.util.TestUtils.problem;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(SpringExtension.class)
public class DiversitySamplerTests {

    private static final long TOPIC_ARRAYS = 1;
    private static final long TOPIC_GRAPH = 2;

    private static final List<Problem> POOL = List.of(
            problem(1, MasteryState.New),
            problem(2, MasteryState.New),
            problem(3, MasteryState.New),
            problem(4, MasteryState.New),
            problem(5, MasteryState.New),
            problem(6, MasteryState.New));

    private DiversitySampler diversitySampler;

    @Mock private TopicDao topicDao;

    @BeforeEach
    public void setup() {
        diversitySampler = new DiversitySampler(topicDao, new Random(42), 2);
    }

    @Test
    public void testSample_CountCoversPool() {
        List<Problem> sample = diversitySampler.sample(POOL, 10);

        assertEquals(new HashSet<>(POOL), new HashSet<>(sample));
        verifyNoInteractions(topicDao);
    }

    @Test
    public void testSample_CountEqualsPool() {
        assertEquals(new HashSet<>(POOL), new HashSet<>(diversitySampler.sample(POOL, POOL.size())));
    }

    @Test
    public void testSample_EmptyPoolOrZeroCount() {
        assertTrue(diversitySampler.sample(List.of(), 3).isEmpty());
        assertTrue(diversitySampler.sample(POOL, 0).isEmpty());
        verifyNoInteractions(topicDao);
    }

    @Test
    public void testSample_LoadsTopicsForPool() {
        when(topicDao.loadTopicIdsForProblems(anyCollection())).thenReturn(Map.of(
                1L, Set.of(TOPIC_ARRAYS),
                2L, Set.of(TOPIC_ARRAYS),
                3L, Set.of(TOPIC_ARRAYS),
                4L, Set.of(TOPIC_ARRAYS)));

        List<Problem> sample = diversitySampler.sample(POOL, 4);

        assertEquals(4, sample.size());
        assertTrue(sample.stream().filter(problem -> problem.id() <= 4).count() <= 2);
    }

    @Test
    public void testSample_TopicCapRespected() {
        Map<Long, Set<Long>> topicIdsByProblem = Map.of(
                1L, Set.of(TOPIC_ARRAYS),
                2L, Set.of(TOPIC_ARRAYS, TOPIC_GRAPH),
                3L, Set.of(TOPIC_ARRAYS),
                4L, Set.of(TOPIC_GRAPH),
                5L, Set.of(TOPIC_GRAPH));

        for (int seed = 0; seed < 50; seed++) {
            DiversitySampler sampler = new DiversitySampler(topicDao, new Random(seed), 2);
            List<Problem> sample = sampler.sample(POOL, 4, 2, topicIdsByProblem);

            assertEquals(4, sample.size());
            assertEquals(4, sample.stream().map(Problem::id).distinct().count());
            assertTrue(topicCount(sample, topicIdsByProblem, TOPIC_ARRAYS) <= 2);
            assertTrue(topicCount(sample, topicIdsByProblem, TOPIC_GRAPH) <= 2);
        }
    }

    @Test
    public void testSample_FallsBackWhenCapCannotBeMet() {
        Map<Long, Set<Long>> topicIdsByProblem = new HashMap<>();
        for (Problem problem : POOL) {
            topicIdsByProblem.put(problem.id(), Set.of(TOPIC_ARRAYS));
        }

        List<Problem> sample = diversitySampler.sample(POOL, 4, 2, topicIdsByProblem);

        // Only two can be taken under the cap, the other two fill in without it
        assertEquals(4, sample.size());
        assertEquals(4, sample.stream().map(Problem::id).distinct().count());
    }

    @Test
    public void testSample_UnconstrainedProblemsFillFreely() {
        Map<Long, Set<Long>> topicIdsByProblem = Map.of(
                1L, Set.of(TOPIC_ARRAYS),
                2L, Set.of(TOPIC_ARRAYS));

        List<Problem> sample = diversitySampler.sample(POOL, 5, 1, topicIdsByProblem);

        assertEquals(5, sample.size());
        assertEquals(1, topicCount(sample, topicIdsByProblem, TOPIC_ARRAYS));
        assertTrue(sample.stream().map(Problem::id).collect(Collectors.toSet()).containsAll(List.of(3L, 4L, 5L, 6L)));
    }

    @Test
    public void testSample_SameSeedSameResult() {
        List<Problem> first = new DiversitySampler(topicDao, new Random(1234), 2).sample(POOL, 3, 2, Map.of());
        List<Problem> second = new DiversitySampler(topicDao, new Random(1234), 2).sample(POOL, 3, 2, Map.of());

        assertEquals(first, second);
    }

    @Test
    public void testSample_NoPositionalBias() {
        DiversitySampler sampler = new DiversitySampler(topicDao, new Random(7), 2);
        List<Problem> pool = POOL.subList(0, 4);
        Map<Long, Integer> pickCounts = new HashMap<>();

        int runs = 4000;
        for (int run = 0; run < runs; run++) {
            Problem picked = sampler.sample(pool, 1, 2, Map.of()).get(0);
            pickCounts.merge(picked.id(), 1, Integer::sum);
        }

        for (Problem problem : pool) {
            int count = pickCounts.getOrDefault(problem.id(), 0);
            assertTrue(count > 850 && count < 1150, "Problem " + problem.id() + " picked " + count + " times");
        }
    }

    private static long topicCount(List<Problem> sample, Map<Long, Set<Long>> topicIdsByProblem, long topicId) {
        return sample.stream()
                .filter(problem -> topicIdsByProblem.getOrDefault(problem.id(), Set.of()).contains(topicId))
                .count();
    }
}
