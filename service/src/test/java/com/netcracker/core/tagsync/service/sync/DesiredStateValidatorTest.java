package com.netcracker.core.tagsync.service.sync;

import com.netcracker.core.tagsync.error.DuplicateEntityNameException;
import com.netcracker.core.tagsync.error.InvalidDesiredStateException;
import com.netcracker.core.tagsync.model.DesiredState;
import com.netcracker.core.tagsync.model.EntityType;
import org.junit.jupiter.api.Test;

import static com.netcracker.core.tagsync.TestJson.json;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DesiredStateValidatorTest {

    @Test
    void sameNameInDifferentTypesIsFine() {
        DesiredState desired = DesiredState.fromJson(json("{tags: [{name: 'X'}], triggers: [{name: 'X'}]}"));

        assertThatCode(() -> DesiredStateValidator.validate(desired)).doesNotThrowAnyException();
    }

    @Test
    void duplicatesAreDetectedCaseInsensitively() {
        DesiredState desired = DesiredState.fromJson(json("{variables: [{name: 'Page Path'}, {name: 'page path '}]}"));

        assertThatThrownBy(() -> DesiredStateValidator.validate(desired))
                .isInstanceOf(DuplicateEntityNameException.class)
                .hasFieldOrPropertyWithValue("entityType", EntityType.VARIABLE)
                .hasMessage("Duplicate variable name in desired config: \"page path \"");
    }

    @Test
    void blankNamesAreRejected() {
        DesiredState desired = DesiredState.fromJson(json("{folders: [{name: '  '}]}"));

        assertThatThrownBy(() -> DesiredStateValidator.validate(desired))
                .isInstanceOf(InvalidDesiredStateException.class)
                .hasMessage("Desired folder missing a valid name.");
    }
}
