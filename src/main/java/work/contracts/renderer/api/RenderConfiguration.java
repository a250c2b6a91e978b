package work.contracts.renderer.api;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import work.contracts.renderer.config.RenderDefaults;

/**
 * Immutable configuration of one render invocation.
 *
 * @param sourceRoots directories searched for imported feature modules, in order
 * @param protectedMetadataFields assignments that are never folded into decorator arguments
 * @param metadataOrder statement names moved to the top of the output, in this order
 */
public record RenderConfiguration(
    Path templatePath,
    List<Path> sourceRoots,
    Optional<Path> outputPath,
    Whitelist whitelist,
    String reservedCapability,
    List<String> ignoredImportPrefixes,
    Set<String> vaultTypeNames,
    List<String> metadataFields,
    Set<String> protectedMetadataFields,
    List<String> hookNames,
    List<String> metadataOrder,
    Set<String> foldedDecorators,
    String headerPrefix,
    String headerMarker,
    String hashingAlgorithm,
    boolean useGit,
    Optional<Path> gitRepoRoot,
    boolean useFullFilepathInHeaders,
    boolean renderMetadataAtTopOfFile,
    boolean includeAutogenWarning,
    String autogenWarning,
    boolean applyFormatting,
    int supportedApiMajorVersion,
    List<String> thirdPartyPathMarkers,
    LogLevel logLevel
) {
    public RenderConfiguration {
        Objects.requireNonNull(templatePath, "templatePath");
        Objects.requireNonNull(whitelist, "whitelist");
        Objects.requireNonNull(reservedCapability, "reservedCapability");
        Objects.requireNonNull(headerMarker, "headerMarker");
        Objects.requireNonNull(hashingAlgorithm, "hashingAlgorithm");
        Objects.requireNonNull(outputPath, "outputPath");
        Objects.requireNonNull(gitRepoRoot, "gitRepoRoot");
        Objects.requireNonNull(logLevel, "logLevel");
        if (headerMarker.isBlank()) {
            throw new IllegalArgumentException("headerMarker must not be blank");
        }
        sourceRoots = List.copyOf(sourceRoots);
        ignoredImportPrefixes = List.copyOf(ignoredImportPrefixes);
        vaultTypeNames = Set.copyOf(vaultTypeNames);
        metadataFields = List.copyOf(metadataFields);
        protectedMetadataFields = Set.copyOf(protectedMetadataFields);
        hookNames = List.copyOf(hookNames);
        metadataOrder = List.copyOf(metadataOrder);
        foldedDecorators = Set.copyOf(foldedDecorators);
        thirdPartyPathMarkers = List.copyOf(thirdPartyPathMarkers);
    }

    /** Builder pre-populated from the bundled defaults. */
    public static Builder builder() {
        return new Builder(RenderDefaults.load());
    }

    public static final class Builder {
        private Path templatePath;
        private List<Path> sourceRoots = new ArrayList<>();
        private Optional<Path> outputPath = Optional.empty();
        private Whitelist whitelist;
        private String reservedCapability;
        private List<String> ignoredImportPrefixes;
        private Set<String> vaultTypeNames;
        private List<String> metadataFields;
        private Set<String> protectedMetadataFields;
        private List<String> hookNames;
        private List<String> metadataOrder;
        private Set<String> foldedDecorators;
        private String headerPrefix;
        private String headerMarker;
        private String hashingAlgorithm;
        private boolean useGit;
        private Optional<Path> gitRepoRoot = Optional.empty();
        private boolean useFullFilepathInHeaders;
        private boolean renderMetadataAtTopOfFile;
        private boolean includeAutogenWarning;
        private String autogenWarning;
        private boolean applyFormatting;
        private int supportedApiMajorVersion;
        private List<String> thirdPartyPathMarkers;
        private LogLevel logLevel = LogLevel.INFO;

        private Builder(RenderDefaults defaults) {
            whitelist = defaults.whitelist();
            reservedCapability = defaults.reservedCapability();
            ignoredImportPrefixes = defaults.ignoredImportPrefixes();
            vaultTypeNames = defaults.vaultTypeNames();
            metadataFields = defaults.metadataFields();
            protectedMetadataFields = defaults.protectedMetadataFields();
            hookNames = defaults.hookNames();
            foldedDecorators = defaults.foldedDecorators();
            headerPrefix = defaults.headerPrefix();
            headerMarker = defaults.headerMarker();
            hashingAlgorithm = defaults.hashingAlgorithm();
            useFullFilepathInHeaders = defaults.useFullFilepathInHeaders();
            renderMetadataAtTopOfFile = defaults.renderMetadataAtTopOfFile();
            includeAutogenWarning = defaults.includeAutogenWarning();
            autogenWarning = defaults.autogenWarning();
            applyFormatting = defaults.applyFormatting();
            supportedApiMajorVersion = defaults.supportedApiMajorVersion();
            thirdPartyPathMarkers = defaults.thirdPartyPathMarkers();
        }

        public Builder templatePath(Path templatePath) {
            this.templatePath = templatePath;
            return this;
        }

        public Builder sourceRoots(List<Path> sourceRoots) {
            this.sourceRoots = new ArrayList<>(sourceRoots);
            return this;
        }

        public Builder addSourceRoot(Path sourceRoot) {
            this.sourceRoots.add(sourceRoot);
            return this;
        }

        public Builder outputPath(Path outputPath) {
            this.outputPath = Optional.ofNullable(outputPath);
            return this;
        }

        public Builder whitelist(Whitelist whitelist) {
            this.whitelist = whitelist;
            return this;
        }

        public Builder reservedCapability(String reservedCapability) {
            this.reservedCapability = reservedCapability;
            return this;
        }

        public Builder ignoredImportPrefixes(List<String> ignoredImportPrefixes) {
            this.ignoredImportPrefixes = ignoredImportPrefixes;
            return this;
        }

        public Builder vaultTypeNames(Set<String> vaultTypeNames) {
            this.vaultTypeNames = vaultTypeNames;
            return this;
        }

        public Builder metadataFields(List<String> metadataFields) {
            this.metadataFields = metadataFields;
            return this;
        }

        public Builder protectedMetadataFields(Set<String> protectedMetadataFields) {
            this.protectedMetadataFields = protectedMetadataFields;
            return this;
        }

        public Builder hookNames(List<String> hookNames) {
            this.hookNames = hookNames;
            return this;
        }

        public Builder metadataOrder(List<String> metadataOrder) {
            this.metadataOrder = metadataOrder;
            return this;
        }

        public Builder foldedDecorators(Set<String> foldedDecorators) {
            this.foldedDecorators = foldedDecorators;
            return this;
        }

        public Builder headerPrefix(String headerPrefix) {
            this.headerPrefix = headerPrefix;
            return this;
        }

        public Builder headerMarker(String headerMarker) {
            this.headerMarker = headerMarker;
            return this;
        }

        public Builder hashingAlgorithm(String hashingAlgorithm) {
            this.hashingAlgorithm = hashingAlgorithm;
            return this;
        }

        public Builder useGit(boolean useGit) {
            this.useGit = useGit;
            return this;
        }

        public Builder gitRepoRoot(Path gitRepoRoot) {
            this.gitRepoRoot = Optional.ofNullable(gitRepoRoot);
            return this;
        }

        public Builder useFullFilepathInHeaders(boolean useFullFilepathInHeaders) {
            this.useFullFilepathInHeaders = useFullFilepathInHeaders;
            return this;
        }

        public Builder renderMetadataAtTopOfFile(boolean renderMetadataAtTopOfFile) {
            this.renderMetadataAtTopOfFile = renderMetadataAtTopOfFile;
            return this;
        }

        public Builder includeAutogenWarning(boolean includeAutogenWarning) {
            this.includeAutogenWarning = includeAutogenWarning;
            return this;
        }

        public Builder autogenWarning(String autogenWarning) {
            this.autogenWarning = autogenWarning;
            return this;
        }

        public Builder applyFormatting(boolean applyFormatting) {
            this.applyFormatting = applyFormatting;
            return this;
        }

        public Builder supportedApiMajorVersion(int supportedApiMajorVersion) {
            this.supportedApiMajorVersion = supportedApiMajorVersion;
            return this;
        }

        public Builder thirdPartyPathMarkers(List<String> thirdPartyPathMarkers) {
            this.thirdPartyPathMarkers = thirdPartyPathMarkers;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public RenderConfiguration build() {
            var order = metadataOrder != null ? metadataOrder : defaultMetadataOrder();
            var protectedFields = new LinkedHashSet<String>(metadataFields);
            protectedFields.addAll(protectedMetadataFields);
            return new RenderConfiguration(
                templatePath,
                sourceRoots,
                outputPath,
                whitelist,
                reservedCapability,
                ignoredImportPrefixes,
                vaultTypeNames,
                metadataFields,
                protectedFields,
                hookNames,
                order,
                foldedDecorators,
                headerPrefix,
                headerMarker,
                hashingAlgorithm,
                useGit,
                gitRepoRoot,
                useFullFilepathInHeaders,
                renderMetadataAtTopOfFile,
                includeAutogenWarning,
                autogenWarning,
                applyFormatting,
                supportedApiMajorVersion,
                thirdPartyPathMarkers,
                logLevel
            );
        }

        private List<String> defaultMetadataOrder() {
            var order = new ArrayList<String>();
            if (whitelist.contains(reservedCapability)) {
                order.add(reservedCapability);
            }
            whitelist.modules().stream().filter(module -> !module.equals(reservedCapability)).forEach(order::add);
            order.addAll(metadataFields);
            order.addAll(hookNames);
            return order;
        }
    }
}
