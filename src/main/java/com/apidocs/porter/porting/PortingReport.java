package com.apidocs.porter.porting;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import lombok.Getter;

/**
 * Outcome of one porting run: what was modified and what could not be ported.
 *
 * Collections keep insertion order and modified sets hold no duplicates.
 */
@Getter
public class PortingReport {

    private final Set<Path> modifiedFiles = new LinkedHashSet<>();
    private final Set<String> modifiedTypes = new LinkedHashSet<>();
    private final Set<String> modifiedApis = new LinkedHashSet<>();
    private final List<String> problematicApis = new ArrayList<>();
    private final List<String> addedExceptions = new ArrayList<>();
    private final List<ModifiedElement> modifiedElements = new ArrayList<>();

    private boolean completed;
    private String failureReason;

    public int getTotalModifiedIndividualElements() {
        return modifiedElements.size();
    }

    public List<ModifiedElement> getModifiedElements() {
        return Collections.unmodifiableList(modifiedElements);
    }

    void recordModifiedElement(String element, Path filePath, String docId, boolean eii) {
        modifiedElements.add(new ModifiedElement(element, filePath, docId, eii));
    }

    void recordModifiedType(String docId, Path filePath) {
        modifiedTypes.add(docId);
        modifiedFiles.add(filePath);
    }

    void recordModifiedApi(String docId, Path filePath) {
        modifiedApis.add(docId);
        modifiedFiles.add(filePath);
    }

    void recordProblem(String problem) {
        problematicApis.add(problem);
    }

    void recordAddedException(String cref, String docId) {
        addedExceptions.add("Exception=[" + cref + "] in Member=[" + docId + "]");
    }

    void markCompleted() {
        this.completed = true;
    }

    void markFailed(String reason) {
        this.completed = false;
        this.failureReason = reason;
    }
}
