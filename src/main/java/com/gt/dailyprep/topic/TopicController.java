package com.gt.dailyprep.topic;

import com.gt.dailyprep.model.Topic;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/rest/topics")
public class TopicController {

    private final TopicService topicService;

    public TopicController(TopicService topicService) {
        this.topicService = topicService;
    }

    @GetMapping(produces = "application/json")
    public List<Topic> getAllTopics() {
        return topicService.getAllTopics();
    }

    @PostMapping(produces = "application/json")
    public Topic createTopic(@RequestBody CreateTopicRequest request, HttpServletResponse response) {
        Topic topic = topicService.createTopic(request.name());
        response.setStatus(HttpServletResponse.SC_CREATED);

        return topic;
    }

    @DeleteMapping(value = "/{topicId}")
    public void deleteTopic(@PathVariable("topicId") long topicId) {
        topicService.deleteTopic(topicId);
    }

    private record CreateTopicRequest(String name) { }
}
