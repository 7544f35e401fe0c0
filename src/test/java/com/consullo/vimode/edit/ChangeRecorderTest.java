package com.consullo.vimode.edit;

import com.consullo.vimode.motion.Motion;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ChangeRecorder} and {@link LastChange}.
 *
 * @since 1.0
 */
public class ChangeRecorderTest {

  @Test
  @DisplayName("Nothing is replayed before the first change")
  void replay_NothingRecorded() {
    ChangeRecorder recorder = new ChangeRecorder();
    List<LastChange> performed = new ArrayList<>();

    assertThat(recorder.replay(performed::add)).isFalse();
    assertThat(performed).isEmpty();
    assertThat(recorder.lastChange()).isEmpty();
  }

  @Test
  @DisplayName("A later record replaces the earlier change")
  void record_Overwrites() {
    ChangeRecorder recorder = new ChangeRecorder();
    recorder.record(LastChange.of(LastChange.Kind.DELETE_CHAR));
    recorder.record(LastChange.replace('q'));

    assertThat(recorder.lastChange()).contains(LastChange.replace('q'));
  }

  @Test
  @DisplayName("Records made during a replay are ignored")
  void replay_SuppressesRecording() {
    ChangeRecorder recorder = new ChangeRecorder();
    LastChange original = LastChange.operatorMotion(Operator.DELETE, Motion.WORD_RIGHT);
    recorder.record(original);

    boolean replayed = recorder.replay(change -> {
      assertThat(recorder.isReplaying()).isTrue();
      recorder.record(LastChange.of(LastChange.Kind.DELETE_LINE));
    });

    assertThat(replayed).isTrue();
    assertThat(recorder.isReplaying()).isFalse();
    assertThat(recorder.lastChange()).contains(original);
  }

  @Test
  @DisplayName("The replaying flag is reset when the replayed change fails")
  void replay_Failure_ResetsFlag() {
    ChangeRecorder recorder = new ChangeRecorder();
    recorder.record(LastChange.of(LastChange.Kind.JOIN_LINES));

    assertThatThrownBy(() -> recorder.replay(change -> {
      throw new IllegalStateException("boom");
    })).isInstanceOf(IllegalStateException.class);

    assertThat(recorder.isReplaying()).isFalse();
  }

  @Test
  @DisplayName("Changes that need a parameter cannot be built without one")
  void lastChange_Factories_Validate() {
    assertThatThrownBy(() -> LastChange.of(LastChange.Kind.DELETE_MOTION))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> LastChange.of(LastChange.Kind.REPLACE_CHAR))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> LastChange.operatorMotion(Operator.YANK, Motion.WORD_RIGHT))
        .isInstanceOf(IllegalArgumentException.class);

    LastChange change = LastChange.operatorMotion(Operator.CHANGE, Motion.LINE_END);
    assertThat(change.kind()).isEqualTo(LastChange.Kind.CHANGE_MOTION);
    assertThat(change.motion()).isEqualTo(Motion.LINE_END);
    assertThat(change).isEqualTo(LastChange.operatorMotion(Operator.CHANGE, Motion.LINE_END));
    assertThat(change).isNotEqualTo(LastChange.operatorMotion(Operator.DELETE, Motion.LINE_END));
  }
}
