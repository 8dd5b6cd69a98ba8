package com.apidocs.porter.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.apidocs.porter.config.MergePolicy;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "port" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class PortOptions {

	@Option(names = { "--docs", "-d" }, description = "Root directory of the Docs xml repository to update")
	private Path docsDir;

	@Option(names = { "--intellisense",
			"-i" }, split = ",", description = "Directories containing IntelliSense xml files (comma-separated)")
	private List<Path> intelliSenseDirs = new ArrayList<>();

	@Option(names = { "--save", "-s" }, description = "Write the changed Docs files (default: dry run)")
	private boolean save;

	// API filters
	@Option(names = { "--include-assemblies" }, split = ",", description = "Assembly name prefixes to port")
	private List<String> includedAssemblies = new ArrayList<>();

	@Option(names = { "--exclude-assemblies" }, split = ",", description = "Assembly name prefixes to leave alone")
	private List<String> excludedAssemblies = new ArrayList<>();

	@Option(names = { "--include-namespaces" }, split = ",", description = "Namespace prefixes to port")
	private List<String> includedNamespaces = new ArrayList<>();

	@Option(names = { "--exclude-namespaces" }, split = ",", description = "Namespace prefixes to leave alone")
	private List<String> excludedNamespaces = new ArrayList<>();

	@Option(names = { "--include-types" }, split = ",", description = "Simple or full type names to port")
	private List<String> includedTypes = new ArrayList<>();

	@Option(names = { "--exclude-types" }, split = ",", description = "Simple or full type names to leave alone")
	private List<String> excludedTypes = new ArrayList<>();

	// Field toggles
	@Option(names = {
			"--port-type-summaries" }, negatable = true, defaultValue = "true", fallbackValue = "true", description = "Port type summaries")
	private boolean portTypeSummaries;

	@Option(names = {
			"--port-member-summaries" }, negatable = true, defaultValue = "true", fallbackValue = "true", description = "Port member summaries")
	private boolean portMemberSummaries;

	@Option(names = {
			"--port-type-remarks" }, negatable = true, defaultValue = "true", fallbackValue = "true", description = "Port type remarks")
	private boolean portTypeRemarks;

	@Option(names = {
			"--port-member-remarks" }, negatable = true, defaultValue = "true", fallbackValue = "true", description = "Port member remarks")
	private boolean portMemberRemarks;

	@Option(names = {
			"--port-type-params" }, negatable = true, defaultValue = "true", fallbackValue = "true", description = "Port delegate type params")
	private boolean portTypeParams;

	@Option(names = {
			"--port-member-params" }, negatable = true, defaultValue = "true", fallbackValue = "true", description = "Port member params")
	private boolean portMemberParams;

	@Option(names = {
			"--port-type-type-params" }, negatable = true, defaultValue = "true", fallbackValue = "true", description = "Port type typeparams")
	private boolean portTypeTypeParams;

	@Option(names = {
			"--port-member-type-params" }, negatable = true, defaultValue = "true", fallbackValue = "true", description = "Port member typeparams")
	private boolean portMemberTypeParams;

	@Option(names = {
			"--port-member-returns" }, negatable = true, defaultValue = "true", fallbackValue = "true", description = "Port method returns")
	private boolean portMemberReturns;

	@Option(names = {
			"--port-member-properties" }, negatable = true, defaultValue = "true", fallbackValue = "true", description = "Port property values")
	private boolean portMemberProperties;

	@Option(names = {
			"--port-exceptions-new" }, negatable = true, defaultValue = "true", fallbackValue = "true", description = "Add exceptions missing from Docs")
	private boolean portExceptionsNew;

	@Option(names = {
			"--port-exceptions-existing" }, negatable = true, description = "Append IntelliSense text to exceptions Docs already lists")
	private boolean portExceptionsExisting;

	@Option(names = {
			"--exception-collision-threshold" }, defaultValue = "70", description = "Percentage (1-100) of shared words above which an existing exception text is not appended to (default: 70)")
	private int exceptionCollisionThreshold = MergePolicy.DEFAULT_EXCEPTION_COLLISION_THRESHOLD;

	// Behaviour switches
	@Option(names = { "--markdown-remarks" }, negatable = true, description = "Write remarks as markdown inside CDATA")
	private boolean markdownRemarks;

	@Option(names = {
			"--preserve-inheritdoc-tag" }, negatable = true, defaultValue = "true", fallbackValue = "true", description = "Keep <inheritdoc> markers instead of copying the inherited text")
	private boolean preserveInheritDocTag;

	@Option(names = {
			"--skip-interface-implementations" }, negatable = true, description = "Do not document members from the interface member they implement")
	private boolean skipInterfaceImplementations;

	@Option(names = {
			"--skip-interface-remarks" }, negatable = true, defaultValue = "true", fallbackValue = "true", description = "Do not append interface remarks to explicit implementation remarks")
	private boolean skipInterfaceRemarks;

	@Option(names = {
			"--disable-prompts" }, negatable = true, defaultValue = "true", fallbackValue = "true", description = "Never ask on the console how to resolve param name mismatches")
	private boolean disablePrompts;

	// Output
	@Option(names = { "--print-undoc" }, description = "Print the undocumented APIs left after porting")
	private boolean printUndoc;

	@Option(names = { "--print-summary-details" }, description = "Print every modified element")
	private boolean printSummaryDetails;

	@Option(names = { "--report-file", "-r" }, description = "Write a markdown report of the run to this file")
	private Path reportFile;

}
