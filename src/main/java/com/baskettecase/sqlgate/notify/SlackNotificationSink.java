package com.baskettecase.sqlgate.notify;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClient;

import java.util.List;
import java.util.Map;

/**
 * Posts approval requests to a Slack incoming webhook as a block message with
 * execute and reject buttons carrying the request's correlation id.
 */
@Slf4j
public class SlackNotificationSink implements NotificationSink {

    private final RestClient restClient;
    private final String webhookUrl;
    private final int maxQueryChars;

    public SlackNotificationSink(RestClient restClient, String webhookUrl, int maxQueryChars) {
        this.restClient = restClient;
        this.webhookUrl = webhookUrl;
        this.maxQueryChars = maxQueryChars;
    }

    @Override
    public boolean notify(ApprovalRequest request) {
        ResponseEntity<Void> response = restClient.post()
            .uri(webhookUrl)
            .contentType(MediaType.APPLICATION_JSON)
            .body(Map.of("blocks", blocks(request)))
            .retrieve()
            .toBodilessEntity();

        log.info("📣 Sent approval request for workspace {} to Slack ({})",
            request.workspaceId(), response.getStatusCode());
        return response.getStatusCode().is2xxSuccessful();
    }

    List<Map<String, Object>> blocks(ApprovalRequest request) {
        return List.of(
            Map.of("type", "header",
                "text", plainText("⚠️ Query waiting for approval")),
            Map.of("type", "section",
                "fields", List.of(
                    markdown("*User:*\n" + request.username()),
                    markdown("*Server:*\n" + request.server()),
                    markdown("*Database:*\n" + request.database()),
                    markdown("*Risk:*\n" + request.riskLabel()))),
            Map.of("type", "section",
                "text", markdown("*Query:*\n```" + truncate(request.queryText()) + "```")),
            Map.of("type", "actions",
                "block_id", "approval_actions",
                "elements", List.of(
                    button("▶️ Execute", "primary", "execute_query", request.correlationId()),
                    button("❌ Reject", "danger", "reject_query", request.correlationId())))
        );
    }

    private String truncate(String query) {
        if (query.length() <= maxQueryChars) {
            return query;
        }
        return query.substring(0, maxQueryChars) + "\n... (truncated)";
    }

    private static Map<String, Object> plainText(String text) {
        return Map.of("type", "plain_text", "text", text, "emoji", true);
    }

    private static Map<String, Object> markdown(String text) {
        return Map.of("type", "mrkdwn", "text", text);
    }

    private static Map<String, Object> button(String text, String style, String actionId, String value) {
        return Map.of(
            "type", "button",
            "text", plainText(text),
            "style", style,
            "value", value,
            "action_id", actionId);
    }
}
