package org.xcos.csp.decoding;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.xcos.csp.assembly.AssembledModel;
import org.xcos.csp.encoding.DomainEncoder;
import org.xcos.csp.encoding.EncodedVariable;
import org.xcos.csp.exceptions.DecodeException;
import org.xcos.csp.model.Variable;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SolutionDecoderTest {

    private final DomainEncoder encoder = new DomainEncoder();
    private final SolutionDecoder decoder = new SolutionDecoder();

    @Test
    @DisplayName("Every index of a discrete domain decodes to the element in that slot")
    void indexRoundTrip() {
        List<Object> domain = List.of("Mon_9am", "Mon_2pm", "Tue_9am", "Mon_9am");
        EncodedVariable slot = encoder.encode(Variable.builder().name("slot").domain(domain).build());

        for (int i = 0; i < domain.size(); i++) {
            assertThat(decoder.decodeValue(slot, i)).isEqualTo(domain.get(i));
        }
    }

    @Test
    @DisplayName("Integer domains decode to the assigned integer with no offset")
    void integerIdentity() {
        EncodedVariable x = encoder.encode(Variable.of("x", 10, 20, 30));

        assertThat(decoder.decodeValue(x, 20)).isEqualTo(20);
        assertThat(decoder.decodeValue(x, 20)).isInstanceOf(Integer.class);
    }

    @Test
    @DisplayName("Long-valued domains decode to longs")
    void longValued() {
        EncodedVariable x = encoder.encode(Variable.of("x", 1L, 2L));

        assertThat(decoder.decodeValue(x, 2)).isEqualTo(2L);
    }

    @Test
    @DisplayName("Should fail loudly on an index outside the table")
    void shouldRejectOutOfRangeIndex() {
        EncodedVariable slot = encoder.encode(Variable.of("slot", "a", "b"));

        assertThatThrownBy(() -> decoder.decodeValue(slot, 2))
            .isInstanceOf(DecodeException.class)
            .hasMessageContaining("slot");
        assertThatThrownBy(() -> decoder.decodeValue(slot, -1)).isInstanceOf(DecodeException.class);
    }

    @Test
    @DisplayName("Unassigned variables are omitted, others keep declaration order")
    void omitsUnassigned() {
        Map<String, EncodedVariable> variables = encoder.encodeAll(List.of(
            Variable.of("b", 1, 2), Variable.of("a", "red", "green"), Variable.of("c", 5)));
        AssembledModel model = new AssembledModel("m", variables, List.of(), null, null);
        Map<EncodedVariable, Integer> assignments = new HashMap<>();
        assignments.put(variables.get("b"), 2);
        assignments.put(variables.get("a"), 1);

        Map<String, Object> solution = decoder.decode(model, assignments);

        assertThat(solution).containsExactly(Map.entry("b", 2), Map.entry("a", "green"));
        assertThat(solution).doesNotContainKey("c");
    }
}
