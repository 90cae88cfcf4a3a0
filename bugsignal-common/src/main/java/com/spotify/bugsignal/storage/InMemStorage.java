/*-
 * -\-\-
 * BugSignal Common
 * --
 * Copyright (C) 2024 Spotify AB
 * --
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * -/-/-
 */
package com.spotify.bugsignal.storage;

import static java.util.stream.Collectors.toList;

import com.spotify.bugsignal.model.Chat;
import com.spotify.bugsignal.model.ListenerDefinition;
import com.spotify.bugsignal.model.Subscription;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * A {@link Storage} kept in memory. Used in tests and for running without a database.
 */
public class InMemStorage implements Storage {

  private final ConcurrentMap<Integer, ListenerDefinition> definitions = new ConcurrentHashMap<>();
  private final ConcurrentMap<Long, Chat> chats = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Subscription> subscriptions = new ConcurrentHashMap<>();

  public void storeListenerDefinition(ListenerDefinition definition) {
    definitions.put(definition.id(), definition);
  }

  public void deleteListenerDefinition(int listenerId) {
    definitions.remove(listenerId);
  }

  public void storeChat(Chat chat) {
    chats.put(chat.id(), chat);
  }

  public void storeSubscription(Subscription subscription) {
    subscriptions.put(subscription.chatId() + "#" + subscription.listenerId(), subscription);
  }

  @Override
  public List<ListenerDefinition> listenerDefinitions(boolean activeOnly) {
    return definitions.values().stream()
        .filter(definition -> !activeOnly || definition.active())
        .sorted(Comparator.comparingInt(ListenerDefinition::id))
        .collect(toList());
  }

  @Override
  public List<Long> subscribers(int listenerId, boolean activeOnly) {
    return subscriptions.values().stream()
        .filter(subscription -> subscription.listenerId() == listenerId)
        .filter(subscription -> chats.containsKey(subscription.chatId()))
        .filter(subscription -> !activeOnly
                                || (subscription.active() && chats.get(subscription.chatId()).active()))
        .map(Subscription::chatId)
        .sorted()
        .collect(toList());
  }

  @Override
  public List<Chat> privateChats(boolean activeOnly) {
    return chats.values().stream()
        .filter(Chat::isPrivate)
        .filter(chat -> !activeOnly || chat.active())
        .sorted(Comparator.comparingLong(Chat::id))
        .collect(toList());
  }

  @Override
  public void close() {
    // nothing to release
  }
}
