package at.sv.energy.api;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SwitchStateTest {

    @Test
    void isOn_comparesByValue() {
        SwitchState state = SwitchState.builder().powerOn(Boolean.valueOf("true")).build();

        assertThat(state.isOn()).isTrue();
        assertThat(state.isOff()).isFalse();
    }

    @Test
    void isOff_powerOnFalse() {
        SwitchState state = SwitchState.builder().powerOn(false).build();

        assertThat(state.isOff()).isTrue();
        assertThat(state.isOn()).isFalse();
    }

    @Test
    void powerOnAbsent_neitherOnNorOff() {
        SwitchState state = SwitchState.builder().brightness(100).build();

        assertThat(state.isOn()).isFalse();
        assertThat(state.isOff()).isFalse();
        assertThat(state.isEmpty()).isFalse();
    }

    @Test
    void noFields_isEmpty() {
        assertThat(SwitchState.builder().build().isEmpty()).isTrue();
    }
}
