package com.gt.dailyprep.topic;

import com.gt.dailyprep.conf.CachingConfig;
import com.gt.dailyprep.exception.DuplicateEntryException;
import com.gt.dailyprep.exception.TopicNotFoundException;
import com.gt.dailyprep.exception.ValidationException;
import com.gt.dailyprep.model.Topic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class TopicService {

    private static final Logger log = LoggerFactory.getLogger(TopicService.class);

    public static final int MAX_TOPIC_NAME_LENGTH = 100;

    private final TopicDao topicDao;

    public TopicService(TopicDao topicDao) {
        this.topicDao = topicDao;
    }

    @Cacheable(value = CachingConfig.TOPICS)
    public List<Topic> getAllTopics() {
        return topicDao.loadAllTopics();
    }

    @CacheEvict(value = CachingConfig.TOPICS, allEntries = true)
    public Topic createTopic(String name) {
        String trimmedName = validateTopicName(name);

        if (topicDao.findTopicByName(trimmedName) != null) {
            throw new DuplicateEntryException("A topic with this name already exists");
        }

        Topic topic = topicDao.createTopic(trimmedName);
        log.info("Created topic {} ({})", topic.name(), topic.id());

        return topic;
    }

    // Used by imports, which create any topic they name that does not exist yet
    @CacheEvict(value = CachingConfig.TOPICS, allEntries = true)
    public Topic findOrCreateTopic(String name) {
        String trimmedName = validateTopicName(name);

        Topic existing = topicDao.findTopicByName(trimmedName);
        if (existing != null) {
            return existing;
        }

        return topicDao.createTopic(trimmedName);
    }

    @CacheEvict(value = CachingConfig.TOPICS, allEntries = true)
    public void deleteTopic(long topicId) {
        if (topicDao.deleteTopic(topicId) == 0) {
            throw new TopicNotFoundException("Topic " + topicId + " not found");
        }

        log.info("Deleted topic {}", topicId);
    }

    public static String validateTopicName(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Topic name cannot be empty");
        }

        String trimmedName = name.trim();
        if (trimmedName.length() > MAX_TOPIC_NAME_LENGTH) {
            throw new ValidationException("Topic name must be " + MAX_TOPIC_NAME_LENGTH + " characters or less");
        }

        return trimmedName;
    }
}
