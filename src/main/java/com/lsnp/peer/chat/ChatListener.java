package com.lsnp.peer.chat;

public interface ChatListener {

    default void onDirectMessage(DirectMessage message) {}
}
