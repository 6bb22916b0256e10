package com.orthosense.service.session;

import com.orthosense.domain.ExerciseLabel;
import org.junit.jupiter.api.Test;

import static com.orthosense.domain.ExerciseLabel.HURDLE_STEP;
import static com.orthosense.domain.ExerciseLabel.SIDE_LUNGE;
import static com.orthosense.domain.ExerciseLabel.SIT_TO_STAND;
import static org.assertj.core.api.Assertions.assertThat;

class VoteTallyTest {

    @Test
    void majorityWinsWithShareOfVotes() {
        VoteTally tally = new VoteTally();
        add(tally, SIDE_LUNGE, 3);
        add(tally, HURDLE_STEP, 5);
        add(tally, SIT_TO_STAND, 2);

        assertThat(tally.winner()).contains(HURDLE_STEP);
        assertThat(tally.confidence()).isEqualTo(0.5);
        assertThat(tally.totalVotes()).isEqualTo(10);
        assertThat(tally.asMap()).containsEntry(SIDE_LUNGE, 3);
    }

    @Test
    void tieGoesToFirstLabelVotedFor() {
        VoteTally tally = new VoteTally();
        tally.add(SIT_TO_STAND);
        tally.add(HURDLE_STEP);
        tally.add(HURDLE_STEP);
        tally.add(SIT_TO_STAND);

        assertThat(tally.winner()).contains(SIT_TO_STAND);
    }

    @Test
    void emptyTallyHasNoWinner() {
        VoteTally tally = new VoteTally();

        assertThat(tally.isEmpty()).isTrue();
        assertThat(tally.winner()).isEmpty();
        assertThat(tally.confidence()).isZero();
        assertThat(tally.votesFor(ExerciseLabel.DEEP_SQUAT)).isZero();
    }

    private static void add(VoteTally tally, ExerciseLabel label, int times) {
        for (int i = 0; i < times; i++) {
            tally.add(label);
        }
    }
}
