package com.deepansh.kernel.capability;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CapabilityManagerTest {

    private CapabilityManager manager;

    @BeforeEach
    void setUp() {
        manager = new CapabilityManager();
        manager.grant("parent", List.of(
                Capability.fileRead("/data/*"),
                Capability.toolInvoke("file_read"),
                Capability.llmMaxTokens(2048)));
    }

    @Test
    void check_heldCapability_isGranted() {
        assertThat(manager.check("parent", Capability.fileRead("/data/x.txt")).granted()).isTrue();
    }

    @Test
    void check_missingCapability_isDeniedWithReason() {
        CapabilityCheck check = manager.check("parent", Capability.shellExec("ls"));
        assertThat(check.granted()).isFalse();
        assertThat(check.reason()).contains("SHELL_EXEC(ls)");
        assertThatThrownBy(check::require).isInstanceOf(CapabilityDeniedException.class);
    }

    @Test
    void check_unknownAgent_isDenied() {
        assertThat(manager.check("ghost", Capability.toolAll()).granted()).isFalse();
    }

    @Test
    void checkAll_returnsFirstDenial() {
        CapabilityCheck check = manager.checkAll("parent", List.of(
                Capability.fileRead("/data/a"), Capability.fileWrite("/data/a")));
        assertThat(check.granted()).isFalse();
        assertThat(check.reason()).contains("FILE_WRITE");
    }

    @Test
    void grantInherited_escalation_grantsNothingToChild() {
        assertThatThrownBy(() -> manager.grantInherited("parent", "child",
                List.of(Capability.fileRead("/data/*"), Capability.shellExec("*"))))
                .isInstanceOf(PrivilegeEscalationException.class);

        assertThat(manager.list("child")).isEmpty();
    }

    @Test
    void grantInherited_subset_grantsChild() {
        manager.grantInherited("parent", "child", List.of(Capability.fileRead("/data/public/*")));

        assertThat(manager.check("child", Capability.fileRead("/data/public/readme")).granted()).isTrue();
        assertThat(manager.check("child", Capability.fileRead("/data/private/key")).granted()).isFalse();
    }

    @Test
    void grantInherited_childOmittingTokenBound_receivesParentBound() {
        List<Capability> granted = manager.grantInherited("parent", "child",
                List.of(Capability.fileRead("/data/public/*")));

        assertThat(granted).contains(Capability.llmMaxTokens(2048));
        assertThat(manager.maxTokenBound("child")).hasValue(2048);
    }

    @Test
    void grantInherited_childWithLowerTokenBound_keepsItsOwn() {
        manager.grantInherited("parent", "child", List.of(Capability.llmMaxTokens(256)));

        assertThat(manager.list("child")).containsExactly(Capability.llmMaxTokens(256));
    }

    @Test
    void maxTokenBound_returnsLargestBound() {
        manager.grant("agent", List.of(Capability.llmMaxTokens(512), Capability.llmMaxTokens(8192)));
        assertThat(manager.maxTokenBound("agent")).hasValue(8192);
        assertThat(manager.maxTokenBound("parent")).hasValue(2048);
        assertThat(manager.maxTokenBound("ghost")).isEmpty();
    }

    @Test
    void revoke_removesAllGrants() {
        manager.revoke("parent");
        assertThat(manager.list("parent")).isEmpty();
        assertThat(manager.check("parent", Capability.fileRead("/data/x")).granted()).isFalse();
    }
}
