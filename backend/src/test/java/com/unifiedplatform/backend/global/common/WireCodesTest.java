package com.unifiedplatform.backend.global.common;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.unifiedplatform.backend.global.error.ProblemException;
import com.unifiedplatform.backend.modules.request.domain.ProgramRequestStatus;
import com.unifiedplatform.backend.modules.request.domain.ProgramType;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

class WireCodesTest {

    @Test
    void enumsTravelAsLowerCaseCodes() {
        assertThat(WireCodes.code(ProgramRequestStatus.UNDER_REVIEW)).isEqualTo("under_review");
        assertThat(WireCodes.code(null)).isNull();
        assertThat(WireCodes.parse(ProgramType.class, " Community_Service ", "program_type"))
                .isEqualTo(ProgramType.COMMUNITY_SERVICE);
    }

    @Test
    void unknownCodeIsAValidationProblemNamingTheField() {
        assertThatThrownBy(() -> WireCodes.parse(ProgramType.class, "hackathon", "program_type"))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
                    assertThat(ex.getCode()).isEqualTo("INVALID_PROGRAM_TYPE");
                    assertThat(ex.getDetailMessage()).contains("student_activity");
                });
    }

    @Test
    void blankIsMissingOnlyWhenRequired() {
        assertThat(WireCodes.parseNullable(ProgramType.class, "  ", "program_type")).isNull();
        assertThatThrownBy(() -> WireCodes.parse(ProgramType.class, null, "program_type"))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("PROGRAM_TYPE_REQUIRED"));
    }

    @Test
    void malformedIdentifierResolvesToNotFound() {
        assertThat(Identifiers.resolveOrNotFound(null, "REQUEST_NOT_FOUND", "program request")).isNull();
        assertThat(Identifiers.tryParse("not-a-uuid")).isEmpty();
        assertThatThrownBy(() -> Identifiers.resolveOrNotFound("R1", "REQUEST_NOT_FOUND", "program request"))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
                    assertThat(ex.getCode()).isEqualTo("REQUEST_NOT_FOUND");
                });
    }
}
