package com.gt.dailyprep.topic;

import com.gt.dailyprep.exception.DuplicateEntryException;
import com.gt.dailyprep.exception.TopicNotFoundException;
import com.gt.dailyprep.exception.ValidationException;
import com.gt.dailyprep.model.Topic;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(SpringExtension.class)
public class TopicServiceTests {

    private static final Topic MONOTONIC_STACK = new Topic(30, "Monotonic Stack", Instant.EPOCH);

    private TopicService topicService;

    @Mock private TopicDao topicDao;

    @BeforeEach
    public void setup() {
        topicService = new TopicService(topicDao);
    }

    @Test
    public void testCreateTopic() {
        when(topicDao.createTopic("Monotonic Stack")).thenReturn(MONOTONIC_STACK);

        assertEquals(MONOTONIC_STACK, topicService.createTopic("  Monotonic Stack "));
    }

    @Test
    public void testCreateTopic_Duplicate() {
        when(topicDao.findTopicByName("monotonic stack")).thenReturn(MONOTONIC_STACK);

        assertThrows(DuplicateEntryException.class, () -> topicService.createTopic("monotonic stack"));
        verify(topicDao, never()).createTopic(anyString());
    }

    @Test
    public void testCreateTopic_InvalidName() {
        assertThrows(ValidationException.class, () -> topicService.createTopic("   "));
        assertThrows(ValidationException.class, () -> topicService.createTopic(null));
        assertThrows(ValidationException.class, () -> topicService.createTopic("x".repeat(101)));

        verifyNoInteractions(topicDao);
    }

    @Test
    public void testFindOrCreateTopic() {
        when(topicDao.findTopicByName("Monotonic Stack")).thenReturn(MONOTONIC_STACK);

        assertEquals(MONOTONIC_STACK, topicService.findOrCreateTopic("Monotonic Stack"));
        verify(topicDao, never()).createTopic(anyString());

        when(topicDao.findTopicByName("Segment Tree")).thenReturn(null);
        topicService.findOrCreateTopic("Segment Tree ");
        verify(topicDao).createTopic("Segment Tree");
    }

    @Test
    public void testDeleteTopic() {
        when(topicDao.deleteTopic(30)).thenReturn(1);

        topicService.deleteTopic(30);

        verify(topicDao).deleteTopic(30);
    }

    @Test
    public void testDeleteTopic_NotFound() {
        when(topicDao.deleteTopic(30)).thenReturn(0);

        assertThrows(TopicNotFoundException.class, () -> topicService.deleteTopic(30));
    }
}
