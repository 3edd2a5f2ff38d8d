package com.openforge.toolrelay.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.toolrelay.llm.model.Message;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the message list the model sees in one round:
 *
 *   system prompt
 *   visible messages, each assistant answer preceded by the tool rounds
 *     persisted in its custom_content.state
 *   the rounds of the current request
 *
 * State is never sent to the model; attachments are.  The result depends
 * only on the arguments, so the same input always assembles the same list.
 */
@Component
@RequiredArgsConstructor
public class ConversationAssembler {

    private final ObjectMapper objectMapper;

    public List<Message> assemble(String systemPrompt,
                                  List<Message> visibleMessages,
                                  RoundHistory currentRounds) {
        List<Message> assembled = new ArrayList<>();
        assembled.add(Message.system(systemPrompt));

        for (Message message : visibleMessages) {
            if (Message.ROLE_ASSISTANT.equals(message.role())) {
                assembled.addAll(RoundHistory.fromState(message.state(), objectMapper));
            }
            assembled.add(message.withoutState());
        }

        if (currentRounds != null) {
            assembled.addAll(currentRounds.messages());
        }
        return List.copyOf(assembled);
    }
}
