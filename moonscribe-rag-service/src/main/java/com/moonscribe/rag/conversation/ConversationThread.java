package com.moonscribe.rag.conversation;

import com.moonscribe.rag.entity.Conversation;
import com.moonscribe.rag.entity.ConversationMessage;

import java.util.List;

public record ConversationThread(Conversation conversation, List<ConversationMessage> messages) {}
