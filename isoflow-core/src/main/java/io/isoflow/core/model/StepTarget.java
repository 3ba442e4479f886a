package io.isoflow.core.model;

/// Where control goes after a step or branch.
///
/// - {@link Next}: implicit fall-through to the following step
/// - {@link Step}: explicit jump to a step index ("go to step 4", "return to step 2")
/// - {@link End}: explicit jump to the end terminator ("go to end")
///
/// @see Branch#target()
/// @see WorkflowStep#getJumpTarget()
public sealed interface StepTarget permits StepTarget.Next, StepTarget.Step, StepTarget.End {

    /// Returns the implicit fall-through target.
    ///
    /// @return the shared instance, never null
    static StepTarget next() {
        return Next.INSTANCE;
    }

    /// Returns an explicit jump to the given step index.
    ///
    /// @param index 1-based step index, must be positive
    /// @return the target, never null
    static StepTarget step(int index) {
        return new Step(index);
    }

    /// Returns the jump to the end terminator.
    ///
    /// @return the shared instance, never null
    static StepTarget end() {
        return End.INSTANCE;
    }

    /// Returns whether this target is an explicit jump rather than fall-through.
    default boolean isExplicit() {
        return !(this instanceof Next);
    }

    /// Implicit fall-through.
    record Next() implements StepTarget {
        static final Next INSTANCE = new Next();
    }

    /// Explicit jump to a 1-based step index.
    ///
    /// @param index target step index, positive
    record Step(int index) implements StepTarget {
        public Step {
            if (index < 1) {
                throw new IllegalArgumentException("Step index must be positive: " + index);
            }
        }
    }

    /// Jump to the end terminator.
    record End() implements StepTarget {
        static final End INSTANCE = new End();
    }
}
