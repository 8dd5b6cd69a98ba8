package com.apidocs.porter.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import com.apidocs.porter.cli.exception.OptionsValidationException;
import com.apidocs.porter.cli.model.PortOptions;
import com.apidocs.porter.cli.model.ValidatedPortOptions;
import com.apidocs.porter.config.ApiFilter;

public class PortOptionsValidator {

	public ValidatedPortOptions validate(PortOptions o) {
		List<String> errors = new ArrayList<>();

		Path docsDir = null;
		if (o.getDocsDir() == null) {
			errors.add("Docs directory is required (--docs / -d).");
		} else if (!existsDirectory(o.getDocsDir())) {
			errors.add("Docs directory does not exist or is not a directory: " + o.getDocsDir());
		} else {
			docsDir = o.getDocsDir().toAbsolutePath().normalize();
		}

		List<Path> intelliSenseDirs = new ArrayList<>();
		if (o.getIntelliSenseDirs().isEmpty()) {
			errors.add("At least one IntelliSense directory is required (--intellisense / -i).");
		}
		for (Path p : o.getIntelliSenseDirs()) {
			if (!existsDirectory(p)) {
				errors.add("IntelliSense directory does not exist or is not a directory: " + p);
			} else {
				intelliSenseDirs.add(p.toAbsolutePath().normalize());
			}
		}

		if (o.getExceptionCollisionThreshold() < 1 || o.getExceptionCollisionThreshold() > 100) {
			errors.add("Exception collision threshold must be in range 1-100. Got: " + o.getExceptionCollisionThreshold());
		}

		if (o.getReportFile() != null && Files.isDirectory(o.getReportFile())) {
			errors.add("Report file is a directory: " + o.getReportFile());
		}

		List<String> includedAssemblies = clean(o.getIncludedAssemblies());
		List<String> excludedAssemblies = clean(o.getExcludedAssemblies());
		List<String> includedNamespaces = clean(o.getIncludedNamespaces());
		List<String> excludedNamespaces = clean(o.getExcludedNamespaces());
		List<String> includedTypes = clean(o.getIncludedTypes());
		List<String> excludedTypes = clean(o.getExcludedTypes());

		checkOverlap("Assembly", includedAssemblies, excludedAssemblies, errors);
		checkOverlap("Namespace", includedNamespaces, excludedNamespaces, errors);
		checkOverlap("Type", includedTypes, excludedTypes, errors);

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		ApiFilter filter = ApiFilter.builder()
				.includedAssemblies(includedAssemblies)
				.excludedAssemblies(excludedAssemblies)
				.includedNamespaces(includedNamespaces)
				.excludedNamespaces(excludedNamespaces)
				.includedTypes(includedTypes)
				.excludedTypes(excludedTypes)
				.build();

		return new ValidatedPortOptions(docsDir, intelliSenseDirs, filter);
	}

	private static boolean existsDirectory(Path p) {
		return p != null && Files.exists(p) && Files.isDirectory(p);
	}

	private static List<String> clean(List<String> raw) {
		return raw.stream().map(String::trim).filter(s -> !s.isEmpty()).distinct().collect(Collectors.toList());
	}

	private static void checkOverlap(String label, List<String> included, List<String> excluded, List<String> errors) {
		for (String name : included) {
			if (excluded.contains(name)) {
				errors.add(label + " '" + name + "' is both included and excluded.");
			}
		}
	}
}
