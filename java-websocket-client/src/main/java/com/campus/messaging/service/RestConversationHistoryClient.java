package com.campus.messaging.service;

import com.campus.messaging.domain.ChatMessage;
import com.campus.messaging.domain.GroupInfo;
import com.campus.messaging.model.MessageRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * History and metadata over the backend REST API, authenticated with the same
 * bearer token the socket uses.
 */
@Slf4j
@Service
public class RestConversationHistoryClient implements ConversationHistoryClient {

    private final RestTemplate restTemplate;
    private final CredentialAccessor credentials;
    private final ConversationCache conversationCache;
    private final String apiBaseUrl;

    public RestConversationHistoryClient(RestTemplate restTemplate,
                                         CredentialAccessor credentials,
                                         ConversationCache conversationCache,
                                         @Value("${messaging.endpoint.base-url:http://localhost:8000}") String apiBaseUrl) {
        this.restTemplate = restTemplate;
        this.credentials = credentials;
        this.conversationCache = conversationCache;
        this.apiBaseUrl = apiBaseUrl;
    }

    @Override
    public List<ChatMessage> fetchHistory(String conversationId) {
        URI uri = UriComponentsBuilder.fromHttpUrl(apiBaseUrl)
            .path("/api/messages/")
            .queryParam("group", conversationId)
            .build()
            .encode()
            .toUri();

        try {
            ResponseEntity<MessageRecord[]> response =
                restTemplate.exchange(uri, HttpMethod.GET, authorizedRequest(), MessageRecord[].class);
            MessageRecord[] body = response.getBody();
            if (body == null) {
                return List.of();
            }

            List<ChatMessage> messages = new ArrayList<>(body.length);
            for (MessageRecord record : body) {
                if (record != null && record.getContent() != null) {
                    messages.add(record.toChatMessage(conversationId));
                }
            }
            log.debug("Retrieved {} messages from history for conversation {}", messages.size(), conversationId);
            return messages;

        } catch (RestClientException e) {
            log.error("Error retrieving history for conversation {}: {}", conversationId, e.getMessage());
            return List.of();
        }
    }

    @Override
    public GroupInfo fetchGroupMetadata(String conversationId) {
        Optional<GroupInfo> cached = conversationCache.getGroup(conversationId);
        if (cached.isPresent()) {
            return cached.get();
        }

        URI uri = UriComponentsBuilder.fromHttpUrl(apiBaseUrl)
            .path("/api/message-groups/{id}/")
            .buildAndExpand(conversationId)
            .encode()
            .toUri();

        try {
            ResponseEntity<GroupInfo> response =
                restTemplate.exchange(uri, HttpMethod.GET, authorizedRequest(), GroupInfo.class);
            GroupInfo groupInfo = response.getBody();
            if (groupInfo == null) {
                return GroupInfo.empty(conversationId);
            }
            conversationCache.putGroup(conversationId, groupInfo);
            return groupInfo;

        } catch (RestClientException e) {
            log.error("Error retrieving group info for conversation {}: {}", conversationId, e.getMessage());
            return GroupInfo.empty(conversationId);
        }
    }

    private HttpEntity<Void> authorizedRequest() {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        credentials.getAuthToken().ifPresent(headers::setBearerAuth);
        return new HttpEntity<>(headers);
    }
}
