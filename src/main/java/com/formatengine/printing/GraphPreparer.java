package com.formatengine.printing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

import com.formatengine.ir.Condition;
import com.formatengine.ir.ConditionResolver;
import com.formatengine.ir.Info;
import com.formatengine.ir.PrintItem;
import com.formatengine.ir.ResolveConditionContext;
import com.formatengine.ir.WriterInfo;
import com.formatengine.util.LoggerUtil;

/**
 * Turns possibly lazy IR into a {@link PreparedGraph}.
 */
public final class GraphPreparer {
    private static final Logger logger = LoggerUtil.getLogger(GraphPreparer.class);

    private GraphPreparer() {
    }

    public static PreparedGraph prepare(Iterable<PrintItem> items) {
        PreparedGraph graph = new PreparedGraph();
        graph.setRootItems(materialize(items, graph));
        logger.finer("Prepared " + graph.getRootItems().size() + " root items, " + graph.size() + " tagged");
        return graph;
    }

    /**
     * Copies a sequence into an immutable list, tagging the conditions and infos in it.
     * Branches of those conditions stay untouched until requested.
     */
    static List<PrintItem> materialize(Iterable<PrintItem> items, PreparedGraph graph) {
        if (items == null) {
            return Collections.emptyList();
        }
        List<PrintItem> result = new ArrayList<>();
        for (PrintItem item : items) {
            if (item == null) {
                throw new PrintException("Found a null print item");
            }
            if (item instanceof Condition || item instanceof Info) {
                graph.tag(item);
            }
            result.add(item);
        }
        return Collections.unmodifiableList(result);
    }

    static ConditionResolver wrapResolver(Condition condition, PreparedGraph graph) {
        ConditionResolver resolver;
        if (condition.isReference()) {
            Condition reference = condition.getReference();
            resolver = context -> context.getResolvedCondition(reference);
        } else {
            resolver = condition.getResolver();
        }
        return context -> resolver.resolve(new TaggingContext(context, graph));
    }

    /**
     * Tags whatever a resolver looks up, so conditions built outside the walk still get ids.
     */
    private static final class TaggingContext implements ResolveConditionContext {
        private final ResolveConditionContext delegate;
        private final PreparedGraph graph;

        private TaggingContext(ResolveConditionContext delegate, PreparedGraph graph) {
            this.delegate = delegate;
            this.graph = graph;
        }

        @Override
        public Boolean getResolvedCondition(Condition condition) {
            if (condition == null) {
                return null;
            }
            graph.tag(condition);
            return delegate.getResolvedCondition(condition);
        }

        @Override
        public WriterInfo getResolvedInfo(Info info) {
            if (info == null) {
                return null;
            }
            graph.tag(info);
            return delegate.getResolvedInfo(info);
        }

        @Override
        public WriterInfo getWriterInfo() {
            return delegate.getWriterInfo();
        }

        @Override
        public boolean isForcingNoNewLines() {
            return delegate.isForcingNoNewLines();
        }
    }
}
