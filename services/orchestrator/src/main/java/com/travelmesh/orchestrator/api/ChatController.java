package com.travelmesh.orchestrator.api;

import com.travelmesh.orchestrator.domain.chat.ChatRequest;
import com.travelmesh.orchestrator.domain.chat.ChatResponse;
import com.travelmesh.orchestrator.domain.chat.ChatService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
public class ChatController {

    private static final Logger log = LoggerFactory.getLogger(ChatController.class);

    private final ChatService chatService;

    public ChatController(ChatService chatService) {
        this.chatService = chatService;
    }

    @PostMapping("/chat")
    public ChatResponse chat(@Valid @RequestBody ChatRequest request) {
        log.info("Chat from {} (conversation {})", request.callerId(), request.conversationId());
        ChatResponse response = chatService.chat(request);
        log.info("Chat finished: success={} agent={} error={}",
                response.success(), response.agentUsed(), response.error());
        return response;
    }
}
