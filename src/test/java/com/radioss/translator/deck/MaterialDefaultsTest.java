package com.radioss.translator.deck;

import com.radioss.translator.model.FailureCriterion;
import com.radioss.translator.model.FailureModel;
import com.radioss.translator.model.MaterialLaw;
import com.radioss.translator.model.MaterialRecord;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class MaterialDefaultsTest {

    @Test
    void testDefaultMaterialIsStructuralSteel() {
        MaterialRecord material = MaterialDefaults.defaultMaterial(99);

        assertThat(material.getId()).isEqualTo(99);
        assertThat(material.getLaw()).isEqualTo(MaterialLaw.LINEAR_ELASTIC);
        assertThat(material.getParameters())
                .containsEntry("EX", 210000.0)
                .containsEntry("NUXY", 0.3)
                .containsEntry("DENS", 7800.0);
    }

    @Test
    void testOnlyAbsentValuesAreFilled() {
        MaterialRecord material = new MaterialRecord(4);
        material.putParameter("EX", 70000.0);
        CompletionReport report = new CompletionReport();

        MaterialDefaults.complete(material, report);

        assertThat(material.getParameters()).containsEntry("EX", 70000.0).containsEntry("NUXY", 0.3);
        assertThat(report.getCompletions()).extracting(Completion::getDetail)
                .containsExactly("NUXY=0.3", "DENS=7800.0");
    }

    @Test
    void testDamageLawByNameReceivesReferenceCoefficients() {
        MaterialRecord material = new MaterialRecord(5);
        material.setLaw(MaterialLaw.JOHNSON_COOK);
        material.setFailure(new FailureCriterion(FailureModel.JOHNSON));
        CompletionReport report = new CompletionReport();

        MaterialDefaults.complete(material, report);

        assertThat(material.getFailure().getParameters()).hasSize(5).containsAllEntriesOf(Map.of(
                "D1", 0.54, "D2", 3.03, "D3", -2.12, "D4", 0.002, "D5", 0.61));
        assertThat(report.ofKind(CompletionKind.FAILURE_PARAMETER)).hasSize(5);
        assertThat(material.getParameters())
                .containsEntry("A", 220.0)
                .containsEntry("B", 450.0)
                .containsEntry("N", 0.36)
                .containsEntry("C", 0.01)
                .containsEntry("EPS0", 1.0);
    }

    @Test
    void testParameterKeysMatchIgnoringCase() {
        MaterialRecord material = new MaterialRecord(6);
        material.setLaw(MaterialLaw.TABULATED_PLASTIC);
        material.putParameter("FSMOOTH", 1.0);
        CompletionReport report = new CompletionReport();

        MaterialDefaults.complete(material, report);

        assertThat(material.getParameters()).containsEntry("FSMOOTH", 1.0).doesNotContainKey("Fsmooth");
        assertThat(report.ofKind(CompletionKind.MATERIAL_CURVE)).hasSize(1);
        assertThat(material.getCurve()).hasSize(2);
    }
}
