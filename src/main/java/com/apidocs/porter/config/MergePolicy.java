package com.apidocs.porter.config;

import lombok.Builder;
import lombok.Value;

/**
 * Switches controlling which documentation fields are ported and how.
 *
 * Every port toggle gates one field kind independently. Defaults match a
 * regular run of the command line tool.
 */
@Value
@Builder(toBuilder = true)
public class MergePolicy {

    public static final int DEFAULT_EXCEPTION_COLLISION_THRESHOLD = 70;

    @Builder.Default
    boolean portTypeSummaries = true;

    @Builder.Default
    boolean portMemberSummaries = true;

    @Builder.Default
    boolean portTypeRemarks = true;

    @Builder.Default
    boolean portMemberRemarks = true;

    /**
     * Params of delegate types.
     */
    @Builder.Default
    boolean portTypeParams = true;

    @Builder.Default
    boolean portMemberParams = true;

    @Builder.Default
    boolean portTypeTypeParams = true;

    @Builder.Default
    boolean portMemberTypeParams = true;

    @Builder.Default
    boolean portMemberReturns = true;

    /**
     * Property {@code value} elements.
     */
    @Builder.Default
    boolean portMemberProperties = true;

    /**
     * Adds exception elements whose cref is not yet listed on the target member.
     */
    @Builder.Default
    boolean portExceptionsNew = true;

    /**
     * Appends text to exception elements already listed on the target member.
     */
    @Builder.Default
    boolean portExceptionsExisting = false;

    /**
     * Writes remarks as a markdown block instead of structured xml.
     */
    @Builder.Default
    boolean markdownRemarks = false;

    /**
     * Keeps inherit-doc markers as {@code <inheritdoc />} elements instead of
     * copying the inherited text.
     */
    @Builder.Default
    boolean preserveInheritDocTag = true;

    @Builder.Default
    boolean skipInterfaceImplementations = false;

    /**
     * Omits the interface remarks after the explicit interface implementation sentence.
     */
    @Builder.Default
    boolean skipInterfaceRemarks = true;

    @Builder.Default
    boolean disablePrompts = true;

    /**
     * Percentage of words of a new exception text that may already appear in
     * the existing text before the new text is considered a duplicate.
     */
    @Builder.Default
    int exceptionCollisionThreshold = DEFAULT_EXCEPTION_COLLISION_THRESHOLD;

    @Builder.Default
    ApiFilter filter = ApiFilter.includeAll();

    public static MergePolicy defaults() {
        return MergePolicy.builder().build();
    }
}
