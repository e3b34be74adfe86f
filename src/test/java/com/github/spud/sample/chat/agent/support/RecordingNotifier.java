package com.github.spud.sample.chat.agent.support;

import com.github.spud.sample.chat.agent.domain.directory.DirectoryUser;
import com.github.spud.sample.chat.agent.domain.notify.Notifier;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Records every confirmation attempt; can be told to fail
 */
public class RecordingNotifier implements Notifier {

  private final List<DirectoryUser> attempts = new CopyOnWriteArrayList<>();

  private volatile boolean delivers = true;
  private volatile RuntimeException failure;

  public void setDelivers(boolean delivers) {
    this.delivers = delivers;
  }

  public void failWith(RuntimeException failure) {
    this.failure = failure;
  }

  public List<DirectoryUser> attempts() {
    return attempts;
  }

  @Override
  public boolean sendConfirmation(DirectoryUser user) {
    attempts.add(user);
    if (failure != null) {
      throw failure;
    }
    return delivers;
  }
}
