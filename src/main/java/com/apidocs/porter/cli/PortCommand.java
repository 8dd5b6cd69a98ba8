package com.apidocs.porter.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.apidocs.porter.cli.exception.OptionsValidationException;
import com.apidocs.porter.cli.model.PortOptions;
import com.apidocs.porter.cli.model.ValidatedPortOptions;
import com.apidocs.porter.cli.output.PortResultsPrinter;
import com.apidocs.porter.cli.prompt.ConsoleNameMismatchResolver;
import com.apidocs.porter.cli.validation.PortOptionsValidator;
import com.apidocs.porter.config.MergePolicy;
import com.apidocs.porter.porting.NameMismatchResolver;
import com.apidocs.porter.service.PortConfig;
import com.apidocs.porter.service.PortResult;
import com.apidocs.porter.service.PortingService;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command porting IntelliSense xml comments into a Docs xml repository.
 */
@Command(
        name = "port",
        mixinStandardHelpOptions = true,
        version = "api-docs-porter 1.0.0",
        description = "Ports IntelliSense xml comments into the undocumented fields of Docs xml files."
)
public class PortCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(PortCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_INVALID_OPTIONS = 2;

    @Mixin
    private PortOptions options = new PortOptions();

    private final PortOptionsValidator validator = new PortOptionsValidator();
    private final PortResultsPrinter printer = new PortResultsPrinter();
    private final PortingService portingService;

    public PortCommand() {
        this(new PortingService());
    }

    PortCommand(PortingService portingService) {
        this.portingService = portingService;
    }

    @Override
    public Integer call() {
        ValidatedPortOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(error -> log.error(error));
            return EXIT_INVALID_OPTIONS;
        }

        printer.printBanner(options, validated);

        PortConfig config = PortConfig.builder()
                .docsDir(validated.getNormalizedDocsDir())
                .intelliSenseDirs(validated.getNormalizedIntelliSenseDirs())
                .policy(buildPolicy(validated))
                .save(options.isSave())
                .printUndoc(options.isPrintUndoc())
                .reportFile(options.getReportFile())
                .build();

        NameMismatchResolver resolver = options.isDisablePrompts()
                ? NameMismatchResolver.alwaysSkip()
                : new ConsoleNameMismatchResolver();

        PortResult result = portingService.port(config, resolver);
        if (!result.isSuccess()) {
            printer.printFailure(result);
            return EXIT_FAILURE;
        }

        printer.printSuccess(options, result);
        return EXIT_OK;
    }

    private MergePolicy buildPolicy(ValidatedPortOptions v) {
        return MergePolicy.builder()
                .portTypeSummaries(options.isPortTypeSummaries())
                .portMemberSummaries(options.isPortMemberSummaries())
                .portTypeRemarks(options.isPortTypeRemarks())
                .portMemberRemarks(options.isPortMemberRemarks())
                .portTypeParams(options.isPortTypeParams())
                .portMemberParams(options.isPortMemberParams())
                .portTypeTypeParams(options.isPortTypeTypeParams())
                .portMemberTypeParams(options.isPortMemberTypeParams())
                .portMemberReturns(options.isPortMemberReturns())
                .portMemberProperties(options.isPortMemberProperties())
                .portExceptionsNew(options.isPortExceptionsNew())
                .portExceptionsExisting(options.isPortExceptionsExisting())
                .exceptionCollisionThreshold(options.getExceptionCollisionThreshold())
                .markdownRemarks(options.isMarkdownRemarks())
                .preserveInheritDocTag(options.isPreserveInheritDocTag())
                .skipInterfaceImplementations(options.isSkipInterfaceImplementations())
                .skipInterfaceRemarks(options.isSkipInterfaceRemarks())
                .disablePrompts(options.isDisablePrompts())
                .filter(v.getFilter())
                .build();
    }
}
