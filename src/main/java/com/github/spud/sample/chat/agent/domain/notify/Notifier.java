package com.github.spud.sample.chat.agent.domain.notify;

import com.github.spud.sample.chat.agent.domain.directory.DirectoryUser;

/**
 * Sends the "you have been verified" notification.
 * <p>
 * Implementations never throw: failures and timeouts are logged and reported as {@code false}.
 */
public interface Notifier {

  boolean sendConfirmation(DirectoryUser user);
}
