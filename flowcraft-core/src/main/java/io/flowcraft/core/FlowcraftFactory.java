package io.flowcraft.core;

import io.flowcraft.core.capability.InMemoryPersistence;
import io.flowcraft.core.capability.LlmCapability;
import io.flowcraft.core.capability.PersistenceCapability;
import io.flowcraft.core.capability.PricingCapability;
import io.flowcraft.core.capability.SandboxCapability;
import io.flowcraft.core.capability.StubLlmCapability;
import io.flowcraft.core.compiler.GraphCompiler;
import io.flowcraft.core.execution.BackoffPolicy;
import io.flowcraft.core.execution.ExecutionEngine;
import io.flowcraft.core.execution.NodeExecutor;
import io.flowcraft.core.profiling.DefaultPricingTable;
import io.flowcraft.core.template.PathTemplateResolver;
import io.flowcraft.core.template.TemplateResolver;
import io.flowcraft.core.tool.DefaultToolRegistry;
import io.flowcraft.core.tool.ToolRegistry;
import java.time.Clock;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Logger;

/// Factory for wiring {@link FlowcraftEnvironment} instances.
///
/// ### Usage Patterns
///
/// **Builder with a real LLM capability**:
/// {@snippet :
/// var env = FlowcraftFactory.builder()
///     .config(FlowcraftConfig.builder().branchPoolSize(8).build())
///     .llm(new LangChain4jLlmCapability(FlowcraftFactory.loadCredentialsFromEnvironment()))
///     .build();
/// }
///
/// **Offline quick start** (stub LLM, in-memory persistence):
/// {@snippet :
/// var env = FlowcraftFactory.createEnvironment();
/// }
///
/// @see FlowcraftEnvironment
/// @see FlowcraftConfig
public final class FlowcraftFactory {

    private static final Logger logger = Logger.getLogger(FlowcraftFactory.class.getName());

    private FlowcraftFactory() {}

    /// Creates an offline environment with default configuration.
    public static FlowcraftEnvironment createEnvironment() {
        return createEnvironment(new FlowcraftConfig());
    }

    /// Creates an offline environment backed by {@link StubLlmCapability}.
    ///
    /// @param config pool sizes and defaults, not null
    /// @return a wired environment, never null
    public static FlowcraftEnvironment createEnvironment(FlowcraftConfig config) {
        return builder().config(config).build();
    }

    /// Discovers provider credentials from environment variables.
    ///
    /// Picks up every variable named like `*_API_KEY`, `*_KEY`, `*_SECRET` or
    /// `*_TOKEN`, plus `FLOWCRAFT_*` settings.
    ///
    /// @return credential name to value, never null (may be empty)
    public static Map<String, String> loadCredentialsFromEnvironment() {
        return filterCredentials(System.getenv());
    }

    static Map<String, String> filterCredentials(Map<String, String> variables) {
        Map<String, String> credentials = new HashMap<>();
        variables.forEach(
                (key, value) -> {
                    if (value != null && !value.isEmpty() && isCredentialName(key)) {
                        credentials.put(key, value);
                    }
                });
        return credentials;
    }

    private static boolean isCredentialName(String key) {
        String upperKey = key.toUpperCase(Locale.ROOT);
        return upperKey.startsWith("FLOWCRAFT_")
                || upperKey.endsWith("_API_KEY")
                || upperKey.endsWith("_KEY")
                || upperKey.endsWith("_SECRET")
                || upperKey.endsWith("_TOKEN");
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link FlowcraftEnvironment}.
    ///
    /// Every capability is optional: the LLM defaults to {@link StubLlmCapability},
    /// tools to an empty {@link DefaultToolRegistry}, pricing to
    /// {@link DefaultPricingTable}, persistence to {@link InMemoryPersistence}.
    /// No sandbox is wired unless given; nodes with code then fail.
    public static class Builder {
        private FlowcraftConfig config = new FlowcraftConfig();
        private LlmCapability llm;
        private ToolRegistry toolRegistry;
        private SandboxCapability sandbox;
        private PricingCapability pricing;
        private PersistenceCapability persistence;
        private TemplateResolver templateResolver;
        private BackoffPolicy.Sleeper sleeper = BackoffPolicy.Sleeper.SYSTEM;
        private Clock clock = Clock.systemUTC();

        public Builder config(FlowcraftConfig config) {
            this.config = config;
            return this;
        }

        public Builder llm(LlmCapability llm) {
            this.llm = llm;
            return this;
        }

        public Builder toolRegistry(ToolRegistry toolRegistry) {
            this.toolRegistry = toolRegistry;
            return this;
        }

        public Builder sandbox(SandboxCapability sandbox) {
            this.sandbox = sandbox;
            return this;
        }

        public Builder pricing(PricingCapability pricing) {
            this.pricing = pricing;
            return this;
        }

        public Builder persistence(PersistenceCapability persistence) {
            this.persistence = persistence;
            return this;
        }

        public Builder templateResolver(TemplateResolver templateResolver) {
            this.templateResolver = templateResolver;
            return this;
        }

        /// Replaces the wait between transient retries, e.g. with a no-op in tests.
        public Builder sleeper(BackoffPolicy.Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /// Wires the environment.
        ///
        /// @apiNote **Side effects**: creates two fixed thread pools, released by
        /// {@link FlowcraftEnvironment#close()}.
        ///
        /// @return a wired environment, never null
        public FlowcraftEnvironment build() {
            LlmCapability resolvedLlm = llm;
            if (resolvedLlm == null || config.isStubMode()) {
                resolvedLlm = new StubLlmCapability();
                logger.info("Using the stub LLM capability");
            }
            ToolRegistry tools = toolRegistry != null ? toolRegistry : new DefaultToolRegistry();
            PersistenceCapability store =
                    persistence != null ? persistence : new InMemoryPersistence();
            PricingCapability prices = pricing != null ? pricing : new DefaultPricingTable();
            TemplateResolver resolver =
                    templateResolver != null ? templateResolver : new PathTemplateResolver();

            ExecutorService runExecutor = Executors.newFixedThreadPool(config.getRunPoolSize());
            ExecutorService branchExecutor =
                    Executors.newFixedThreadPool(config.getBranchPoolSize());

            NodeExecutor nodeExecutor =
                    new NodeExecutor(resolvedLlm, tools, sandbox, resolver, sleeper);
            ExecutionEngine engine =
                    new ExecutionEngine(
                            new GraphCompiler(),
                            nodeExecutor,
                            runExecutor,
                            branchExecutor,
                            prices,
                            store,
                            clock,
                            config.getBottleneckThreshold());

            return new FlowcraftEnvironment(
                    config, engine, resolvedLlm, tools, store, runExecutor, branchExecutor);
        }
    }
}
