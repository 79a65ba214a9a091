package com.tpgsweep.orchestrator.reconcile;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MicroarchitectureTest {

    @Test
    void expandIsa_compressedMarker_givesBothVariants() {
        Microarchitecture u = new Microarchitecture("cv32e20_im1", "rv32im(c)_zicsr", "ilp32");

        assertThat(u.expandIsa()).containsExactly("rv32im_zicsr", "rv32imc_zicsr");
    }

    @Test
    void expandIsa_markerAtEnd_givesBothVariants() {
        Microarchitecture u = new Microarchitecture("core", "rv32e(c)", "ilp32e");

        assertThat(u.expandIsa()).containsExactly("rv32e", "rv32ec");
    }

    @Test
    void expandIsa_withoutMarker_givesItself() {
        Microarchitecture u = new Microarchitecture("core", "rv32imc_zicsr", "ilp32");

        assertThat(u.expandIsa()).containsExactly("rv32imc_zicsr");
    }

    @Test
    void hasFpu_readsCoreName() {
        assertThat(new Microarchitecture("cv32e40px_corev_pulp_FPU", "rv32imf", "ilp32f").hasFpu()).isTrue();
        assertThat(new Microarchitecture("cv32e40px_corev_pulp", "rv32im", "ilp32f").hasFpu()).isFalse();
    }

    @Test
    void constructor_blankAbi_throws() {
        assertThatThrownBy(() -> new Microarchitecture("core", "rv32i", " "))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("abi");
    }

    // ------------------------------------------------------------------
    // MicroarchitectureCatalog
    // ------------------------------------------------------------------

    @Test
    void catalog_emptySelection_keepsAllTwentyCores() {
        assertThat(new MicroarchitectureCatalog(List.of()).all()).hasSize(20);
    }

    @Test
    void catalog_selection_keepsRequestedOrder() {
        MicroarchitectureCatalog catalog = new MicroarchitectureCatalog(List.of("cv32e40p", "cv32e20_em0"));

        assertThat(catalog.all()).extracting(Microarchitecture::name).containsExactly("cv32e40p", "cv32e20_em0");
    }

    @Test
    void catalog_unknownCore_throws() {
        assertThatThrownBy(() -> new MicroarchitectureCatalog(List.of("cv64a6")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("cv64a6");
    }
}
