package com.example.abac.subject;

import com.example.abac.model.SubjectAttributes;
import reactor.core.publisher.Mono;

/**
 * Source of subject attributes. Completes empty for unknown subjects.
 */
public interface SubjectDirectory {

    Mono<SubjectAttributes> findSubject(String subjectId);
}
