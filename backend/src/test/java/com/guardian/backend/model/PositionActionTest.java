package com.guardian.backend.model;

import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

class PositionActionTest {

    @Test
    void codesAreStableUnderTurkishLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            assertThat(PositionAction.EXIT.code()).isEqualTo("exit");
            assertThat(PositionAction.REALLOCATE.code()).isEqualTo("reallocate");
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void exitRanksFirst() {
        assertThat(PositionAction.EXIT.priority()).isLessThan(PositionAction.REDUCE.priority());
        assertThat(PositionAction.HOLD.priority()).isGreaterThan(PositionAction.ADD.priority());
    }
}
