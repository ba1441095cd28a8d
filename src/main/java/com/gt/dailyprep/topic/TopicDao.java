package com.gt.dailyprep.topic;

import com.gt.dailyprep.model.Topic;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

public interface TopicDao {

    List<Topic> loadAllTopics();

    List<Topic> loadTopics(Collection<Long> topicIds);

    Topic findTopicByName(String name);

    Topic createTopic(String name);

    int deleteTopic(long topicId);

    Map<Long, List<Topic>> loadTopicsForProblems(Collection<Long> problemIds);

    Map<Long, Set<Long>> loadTopicIdsForProblems(Collection<Long> problemIds);

    void setProblemTopics(long problemId, Collection<Long> topicIds);
}
