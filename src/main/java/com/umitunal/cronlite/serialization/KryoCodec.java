package com.umitunal.cronlite.serialization;

import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;

import java.io.ByteArrayOutputStream;

/**
 * Binary serialization using Kryo. Used for append-only records where
 * compactness matters more than readability.
 *
 * @param <T> the type to serialize
 */
public class KryoCodec<T> implements PayloadCodec<T> {
    private final ThreadLocal<Kryo> kryoThreadLocal;
    private final Class<T> type;

    public KryoCodec(Class<T> type) {
        this.type = type;
        this.kryoThreadLocal = ThreadLocal.withInitial(() -> {
            Kryo kryo = new Kryo();
            // Don't require registration for flexibility
            kryo.setRegistrationRequired(false);
            kryo.setReferences(false);
            return kryo;
        });
    }

    @Override
    public byte[] encode(T value) {
        Kryo kryo = kryoThreadLocal.get();
        ByteArrayOutputStream baos = new ByteArrayOutputStream();

        try (Output output = new Output(baos)) {
            kryo.writeObject(output, value);
            output.flush();
            return baos.toByteArray();
        }
    }

    @Override
    public T decode(byte[] bytes) {
        Kryo kryo = kryoThreadLocal.get();

        try (Input input = new Input(bytes)) {
            return kryo.readObject(input, type);
        }
    }
}
