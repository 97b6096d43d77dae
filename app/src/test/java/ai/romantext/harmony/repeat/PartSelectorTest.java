package ai.romantext.harmony.repeat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class PartSelectorTest {

    @Test
    void parsesAllAndIndexLists() {
        assertThat(PartSelector.parse("all")).isSameAs(PartSelector.all());
        assertThat(PartSelector.parse(" ALL ")).isSameAs(PartSelector.all());
        assertThat(PartSelector.parse("2, 0")).isEqualTo(PartSelector.specific(List.of(0, 2)));
    }

    @Test
    void selectsListedPartsInScoreOrderAndSkipsMissingOnes() {
        PartSelector selector = PartSelector.parse("3,1,0");

        assertThat(selector.select(List.of("soprano", "alto", "tenor"))).containsExactly("soprano", "alto");
        assertThat(PartSelector.all().select(List.of("soprano", "alto"))).containsExactly("soprano", "alto");
    }

    @Test
    void rejectsNegativeOrNonNumericEntries() {
        assertThatThrownBy(() -> PartSelector.parse("0,-1"))
                .isInstanceOf(InvalidSelectorException.class)
                .hasMessageContaining("non-negative");
        assertThatThrownBy(() -> PartSelector.parse("bass"))
                .isInstanceOf(InvalidSelectorException.class)
                .hasMessageContaining("bass");
        assertThatThrownBy(() -> PartSelector.specific(List.of()))
                .isInstanceOf(InvalidSelectorException.class);
    }
}
