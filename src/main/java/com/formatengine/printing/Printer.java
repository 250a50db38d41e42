package com.formatengine.printing;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.logging.Logger;

import com.formatengine.ir.Condition;
import com.formatengine.ir.ConditionResolver;
import com.formatengine.ir.Info;
import com.formatengine.ir.PrintItem;
import com.formatengine.ir.ResolveConditionContext;
import com.formatengine.ir.Signal;
import com.formatengine.ir.Text;
import com.formatengine.ir.WriterInfo;
import com.formatengine.util.LoggerUtil;

/**
 * The print-item resolution engine.
 *
 * <p>Walks prepared IR once, left to right and depth first through the chosen condition
 * branches, and produces write items. Emitted output is never revisited: possible line
 * breaks are decided by measuring ahead with {@link LookAhead}, and a condition that depends
 * on something later in the stream sees it as unresolved.</p>
 *
 * <p>A printer holds only its options, so one instance can run passes on several threads.
 * Each call to {@code print} gets fresh writer state and a fresh resolution cache.</p>
 */
public class Printer {
    private static final Logger logger = LoggerUtil.getLogger(Printer.class);

    private final PrintOptions options;

    public Printer(PrintOptions options) {
        this.options = options;
    }

    public List<WriteItem> print(Iterable<PrintItem> items) {
        return print(GraphPreparer.prepare(items));
    }

    public List<WriteItem> print(PreparedGraph graph) {
        return new Pass(graph).run();
    }

    private final class Pass implements ResolveConditionContext {
        private final PreparedGraph graph;
        private final Writer writer;
        private final ResolutionCache cache = new ResolutionCache();
        private final LookAhead lookAhead;
        private final Deque<Frame> frames = new ArrayDeque<>();
        private int newLineGroupDepth;
        private int forceNoNewLinesDepth;

        private Pass(PreparedGraph graph) {
            this.graph = graph;
            this.writer = new Writer(options.getIndentWidth());
            this.lookAhead = new LookAhead(graph, cache, options);
        }

        private List<WriteItem> run() {
            frames.push(new Frame(graph.getRootItems()));

            while (!frames.isEmpty()) {
                Frame frame = frames.peek();
                if (!frame.hasNext()) {
                    frames.pop();
                    continue;
                }

                PrintItem item = frame.next();
                if (item instanceof Text) {
                    _handleText(((Text) item).getText());
                } else if (item instanceof Signal) {
                    _handleSignal((Signal) item);
                } else if (item instanceof Info) {
                    cache.putInfo(graph.tag(item), writer.getWriterInfo());
                } else if (item instanceof Condition) {
                    _handleCondition((Condition) item);
                } else {
                    throw new PrintException("Unsupported print item: " + item.getClass().getName());
                }
            }

            _logUnbalancedState();
            logger.finer("Pass finished: " + cache.getEvaluatedConditionCount() + " condition(s) evaluated, "
                    + graph.size() + " tagged");
            return writer.getItems();
        }

        private void _handleText(String text) {
            if (text.indexOf('\n') < 0) {
                if (!text.isEmpty()) {
                    writer.write(text);
                }
                return;
            }

            // continuation lines are written as they are, without the current indentation
            String[] lines = text.split("\n", -1);
            for (int i = 0; i < lines.length; i++) {
                String line = lines[i];
                if (line.endsWith("\r")) {
                    line = line.substring(0, line.length() - 1);
                }
                if (i > 0) {
                    writer.newLine();
                    writer.startIgnoringIndent();
                }
                if (!line.isEmpty()) {
                    writer.write(line);
                }
                if (i > 0) {
                    writer.finishIgnoringIndent();
                }
            }
        }

        private void _handleSignal(Signal signal) {
            switch (signal) {
                case NEW_LINE -> {
                    if (_allowNewLines()) {
                        writer.newLine();
                    }
                }
                case TAB -> writer.tab();
                case EXPECT_NEW_LINE -> writer.markExpectNewLine();
                case POSSIBLE_NEW_LINE -> {
                    if (_allowNewLines() && _shouldBreak(0)) {
                        writer.newLine();
                    }
                }
                case SPACE_OR_NEW_LINE -> {
                    if (_allowNewLines() && _shouldBreak(1)) {
                        writer.newLine();
                    } else {
                        writer.spaceIfNotTrailing();
                    }
                }
                case START_INDENT -> writer.startIndent();
                case FINISH_INDENT -> writer.finishIndent();
                case QUEUE_START_INDENT -> writer.queueIndent();
                case START_NEW_LINE_GROUP -> newLineGroupDepth++;
                case FINISH_NEW_LINE_GROUP -> {
                    if (newLineGroupDepth == 0) {
                        throw new PrintException("Found a finish new line group without a corresponding start");
                    }
                    newLineGroupDepth--;
                }
                case SINGLE_INDENT -> writer.singleIndent();
                case START_IGNORING_INDENT -> writer.startIgnoringIndent();
                case FINISH_IGNORING_INDENT -> writer.finishIgnoringIndent();
                case START_FORCE_NO_NEW_LINES -> forceNoNewLinesDepth++;
                case FINISH_FORCE_NO_NEW_LINES -> {
                    if (forceNoNewLinesDepth == 0) {
                        throw new PrintException("Found a finish force no new lines without a corresponding start");
                    }
                    forceNoNewLinesDepth--;
                }
                case SPACE_IF_NOT_TRAILING -> writer.spaceIfNotTrailing();
            }
        }

        private void _handleCondition(Condition condition) {
            int id = graph.tag(condition);
            Boolean value;
            if (cache.isConditionEvaluated(id)) {
                value = cache.getCondition(id);
            } else {
                value = _resolve(condition);
                cache.putCondition(id, value);
            }

            List<PrintItem> branch = Boolean.TRUE.equals(value)
                    ? graph.getTruePath(condition)
                    : graph.getFalsePath(condition);
            if (branch.isEmpty()) {
                return;
            }
            if (frames.size() >= options.getMaxNestingDepth()) {
                throw new PrintException("Condition '" + condition.getName()
                        + "' is part of an unresolvable cycle", condition.getName(), null);
            }
            frames.push(new Frame(branch));
        }

        private Boolean _resolve(Condition condition) {
            ConditionResolver resolver = graph.getResolver(condition);
            try {
                Boolean value = resolver.resolve(this);
                if (value == null) {
                    logger.finest("Condition '" + condition.getName() + "' is unresolved, taking the false branch");
                }
                return value;
            } catch (PrintException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new PrintException("Resolver for condition '" + condition.getName() + "' failed: "
                        + e.getMessage(), condition.getName(), e);
            }
        }

        private boolean _allowNewLines() {
            return forceNoNewLinesDepth == 0;
        }

        private boolean _shouldBreak(int leadingWidth) {
            // breaking at the start of a line would only leave it blank
            if (writer.isLineEmpty() || writer.isExpectNewLineNext()) {
                return false;
            }
            return lookAhead.exceedsWidth(frames, writer.getLineColumn(), leadingWidth);
        }

        private void _logUnbalancedState() {
            if (writer.getIndentLevel() != 0) {
                logger.fine("Finished printing with indent level " + writer.getIndentLevel());
            }
            if (writer.getIgnoreIndentCount() != 0) {
                logger.fine("Finished printing while ignoring indent");
            }
            if (newLineGroupDepth != 0) {
                logger.fine("Finished printing inside " + newLineGroupDepth + " new line group(s)");
            }
            if (forceNoNewLinesDepth != 0) {
                logger.fine("Finished printing while forcing no new lines");
            }
        }

        @Override
        public Boolean getResolvedCondition(Condition condition) {
            int id = graph.findId(condition);
            return id >= 0 ? cache.getCondition(id) : null;
        }

        @Override
        public WriterInfo getResolvedInfo(Info info) {
            int id = graph.findId(info);
            return id >= 0 ? cache.getInfo(id) : null;
        }

        @Override
        public WriterInfo getWriterInfo() {
            return writer.getWriterInfo();
        }

        @Override
        public boolean isForcingNoNewLines() {
            return forceNoNewLinesDepth > 0;
        }
    }
}
