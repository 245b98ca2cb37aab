package io.cronstore.commons.guava;

import com.google.common.base.Optional;
import com.google.common.base.Throwables;

public class ThrowablesUtil
{
    private ThrowablesUtil()
    { }

    /**
     * Rethrows unchecked throwables as is and wraps checked ones in a RuntimeException.
     * Callers write {@code throw ThrowablesUtil.propagate(ex)} so that the compiler sees the branch end.
     */
    public static RuntimeException propagate(Throwable throwable)
    {
        Throwables.throwIfUnchecked(throwable);
        throw new RuntimeException(throwable);
    }

    /**
     * Returns the first throwable in the causal chain, starting from {@code throwable} itself,
     * that is an instance of {@code type}.
     */
    public static <X extends Throwable> Optional<X> findCause(Throwable throwable, Class<X> type)
    {
        if (throwable == null) {
            return Optional.absent();
        }
        for (Throwable cause : Throwables.getCausalChain(throwable)) {
            if (type.isInstance(cause)) {
                return Optional.of(type.cast(cause));
            }
        }
        return Optional.absent();
    }

    public static String rootCauseMessage(Throwable throwable)
    {
        Throwable root = Throwables.getRootCause(throwable);
        String message = root.getMessage();
        if (message == null) {
            return root.getClass().getSimpleName();
        }
        return message;
    }
}
