package io.chronoledger.core;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecordingScopeTest {

    @Test
    void nestedScopesReturnToIdleOnlyAtOutermostExit() {
        var scope = new RecordingScope();
        var policy = TemporalPolicy.builder("widget").track("description").scopeRequired(true).build();
        var entity = TemporalEntity.loaded(policy,
                new EntityState(EntityId.random(), "widget", 1, Map.of("description", "a")), scope);

        scope.enter();
        scope.enter();
        entity.set("description", "b");
        scope.exit();

        assertThat(scope.isActive()).isTrue();
        assertThat(scope.depth()).isEqualTo(1);

        scope.exit();

        assertThat(scope.isActive()).isFalse();
        assertThat(entity.isDirty()).isTrue();
        assertThat(entity.isUnscopedDirty()).isFalse();
    }

    @Test
    void exitWithoutEnterFailsImmediately() {
        var scope = new RecordingScope();

        assertThatThrownBy(scope::exit).isInstanceOf(ScopeMisuseException.class);
    }

    @Test
    void tickReleasesOnErrorAndOnlyOnce() {
        var scope = new RecordingScope();

        assertThatThrownBy(() -> {
            try (var tick = scope.enter()) {
                throw new IllegalStateException("boom");
            }
        }).isInstanceOf(IllegalStateException.class);
        assertThat(scope.isActive()).isFalse();

        var tick = scope.enter();
        tick.close();
        tick.close();
        assertThat(scope.depth()).isZero();
    }

    @Test
    void innermostActivityWins() {
        var scope = new RecordingScope();

        try (var outer = scope.enter("import")) {
            assertThat(scope.activity()).isEqualTo("import");
            try (var inner = scope.enter("fix-up")) {
                assertThat(scope.activity()).isEqualTo("fix-up");
            }
            try (var anonymous = scope.enter()) {
                assertThat(scope.activity()).isEqualTo("import");
            }
        }
        assertThat(scope.activity()).isNull();
    }
}
