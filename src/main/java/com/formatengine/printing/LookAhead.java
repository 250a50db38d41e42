package com.formatengine.printing;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

import com.formatengine.ir.Condition;
import com.formatengine.ir.PrintItem;
import com.formatengine.ir.Signal;
import com.formatengine.ir.Text;

/**
 * Measures whether the content up to the next break opportunity fits on the current line.
 *
 * <p>The scan stops at the first of: a hard line break, a possible line break at the same or a
 * shallower new-line group depth, the end of the input, or the point where the line already
 * exceeds the maximum width. Possible breaks inside a deeper group are measured as unbroken.</p>
 *
 * <p>Resolvers are never invoked here. A condition whose value is already known follows that
 * branch: either it was evaluated, or it reuses a condition that was. For any other condition
 * both branches are measured and the content does not fit if either of them exceeds the width.
 * The number of such splits per measurement is bounded; past the bound only the false branch
 * is measured.</p>
 */
final class LookAhead {
    static final int MAX_BRANCH_SPLITS = 32;

    private final PreparedGraph graph;
    private final ResolutionCache cache;
    private final PrintOptions options;

    LookAhead(PreparedGraph graph, ResolutionCache cache, PrintOptions options) {
        this.graph = graph;
        this.cache = cache;
        this.options = options;
    }

    /**
     * @param frames the engine's position, innermost frame first; not modified
     * @param column the current column
     * @param leadingWidth width emitted at the break point itself when not breaking
     */
    boolean exceedsWidth(Deque<Frame> frames, int column, int leadingWidth) {
        int width = column + leadingWidth;
        if (width > options.getMaxWidth()) {
            return true;
        }
        return _exceeds(_copy(frames), width, 0, new int[]{MAX_BRANCH_SPLITS});
    }

    private boolean _exceeds(Deque<Frame> stack, int width, int groupDepth, int[] splitsLeft) {
        int maxWidth = options.getMaxWidth();
        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (!frame.hasNext()) {
                stack.pop();
                continue;
            }

            PrintItem item = frame.next();
            if (item instanceof Text) {
                String text = ((Text) item).getText();
                int newLine = text.indexOf('\n');
                if (newLine >= 0) {
                    return width + Writer.measure(_stripCarriageReturn(text.substring(0, newLine)),
                            options.getIndentWidth()) > maxWidth;
                }
                width += Writer.measure(text, options.getIndentWidth());
            } else if (item instanceof Signal) {
                switch ((Signal) item) {
                    case NEW_LINE, EXPECT_NEW_LINE -> {
                        return width > maxWidth;
                    }
                    case POSSIBLE_NEW_LINE -> {
                        if (groupDepth <= 0) {
                            return width > maxWidth;
                        }
                    }
                    case SPACE_OR_NEW_LINE -> {
                        if (groupDepth <= 0) {
                            return width > maxWidth;
                        }
                        width++;
                    }
                    case TAB, SINGLE_INDENT -> width += options.getIndentWidth();
                    case SPACE_IF_NOT_TRAILING -> width++;
                    case START_NEW_LINE_GROUP -> groupDepth++;
                    case FINISH_NEW_LINE_GROUP -> groupDepth--;
                    default -> {
                        // no width
                    }
                }
            } else if (item instanceof Condition) {
                Condition condition = (Condition) item;
                if (stack.size() >= options.getMaxNestingDepth()) {
                    return width > maxWidth;
                }
                List<PrintItem> branch = _knownBranch(condition);
                if (branch == null) {
                    branch = graph.getFalsePath(condition);
                    List<PrintItem> truePath = graph.getTruePath(condition);
                    if (splitsLeft[0] > 0 && !truePath.isEmpty()) {
                        splitsLeft[0]--;
                        Deque<Frame> trueStack = _copy(stack);
                        trueStack.push(new Frame(truePath));
                        if (_exceeds(trueStack, width, groupDepth, splitsLeft)) {
                            return true;
                        }
                    }
                }
                if (!branch.isEmpty()) {
                    stack.push(new Frame(branch));
                }
            }

            if (width > maxWidth) {
                return true;
            }
        }
        return width > maxWidth;
    }

    /**
     * The branch the engine is known to take, or {@code null} while that still depends on a
     * resolver that has not run.
     */
    private List<PrintItem> _knownBranch(Condition condition) {
        Boolean value;
        int id = graph.findId(condition);
        if (id >= 0 && cache.isConditionEvaluated(id)) {
            value = cache.getCondition(id);
        } else if (condition.isReference()) {
            int referenceId = graph.findId(condition.getReference());
            if (referenceId < 0 || !cache.isConditionEvaluated(referenceId)) {
                return null;
            }
            value = cache.getCondition(referenceId);
        } else {
            return null;
        }
        return Boolean.TRUE.equals(value) ? graph.getTruePath(condition) : graph.getFalsePath(condition);
    }

    private static Deque<Frame> _copy(Deque<Frame> frames) {
        Deque<Frame> copy = new ArrayDeque<>();
        Iterator<Frame> outerFirst = frames.descendingIterator();
        while (outerFirst.hasNext()) {
            Frame frame = outerFirst.next();
            copy.push(new Frame(frame.items, frame.index));
        }
        return copy;
    }

    private static String _stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }
}
