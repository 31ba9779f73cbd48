package io.surfworks.tsetlin.core.engine;

import java.lang.ref.Cleaner;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Exclusive owner of one native machine.
 *
 * <p>The machine is released at most once: by {@link #close()}, or by a
 * cleaner action if the handle becomes unreachable while still live. The
 * address is cleared before the engine's free primitive runs, so a failing
 * free can never be retried. Free failures are logged, not thrown.
 */
public final class NativeHandle implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(NativeHandle.class.getName());
    private static final Cleaner CLEANER = Cleaner.create();

    private final EngineBinding binding;
    private final Release release;
    private final Cleaner.Cleanable cleanable;

    private NativeHandle(EngineBinding binding, long address) {
        this.binding = binding;
        this.release = new Release(binding, address);
        this.cleanable = CLEANER.register(this, release);
    }

    /**
     * Takes ownership of {@code address}.
     */
    public static NativeHandle adopt(EngineBinding binding, long address) {
        if (address == 0L) {
            throw new IllegalArgumentException("Cannot adopt a null machine address");
        }
        return new NativeHandle(binding, address);
    }

    public EngineBinding binding() {
        return binding;
    }

    /**
     * Returns the live address.
     *
     * @throws EngineException with {@code HANDLE_RELEASED} after close
     */
    public long address() {
        long address = release.address.get();
        if (address == 0L) {
            throw EngineException.handleReleased();
        }
        return address;
    }

    public boolean isLive() {
        return release.address.get() != 0L;
    }

    /**
     * Releases the machine. Idempotent.
     */
    @Override
    public void close() {
        cleanable.clean();
    }

    @Override
    public String toString() {
        return "NativeHandle[" + binding.backendName() + "/" + binding.variant()
                + (isLive() ? ", 0x" + Long.toHexString(release.address.get()) : ", released") + "]";
    }

    // Must not reference the NativeHandle, or the cleaner never fires.
    private static final class Release implements Runnable {
        private final EngineBinding binding;
        private final AtomicLong address;

        Release(EngineBinding binding, long address) {
            this.binding = binding;
            this.address = new AtomicLong(address);
        }

        @Override
        public void run() {
            long addr = address.getAndSet(0L);
            if (addr == 0L) {
                return;
            }
            try {
                binding.free(addr);
                LOG.finer(() -> "Freed native machine 0x" + Long.toHexString(addr));
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "Failed to free native machine 0x" + Long.toHexString(addr), e);
            }
        }
    }
}
