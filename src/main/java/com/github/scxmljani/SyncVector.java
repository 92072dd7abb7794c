package com.github.scxmljani;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One synchronization of the network: an action label per automaton (null where the automaton
 * does not take part), in network order, and the label of the resulting joint step.
 */
public final class SyncVector {
  private final List<String> participants;
  private final String result;

  SyncVector(final List<String> participants, final String result) {
    this.participants = Collections.unmodifiableList(new ArrayList<>(participants));
    this.result = result;
  }

  public List<String> getParticipants() {
    return participants;
  }

  public String getResult() {
    return result;
  }

  @Override
  public String toString() {
    return "SyncVector " + participants + " -> " + result;
  }
}
