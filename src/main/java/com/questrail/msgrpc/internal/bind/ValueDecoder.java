package com.questrail.msgrpc.internal.bind;

import com.questrail.msgrpc.msgpack.ConvertException;
import com.questrail.msgrpc.msgpack.ExtensionCodec;
import com.questrail.msgrpc.msgpack.ExtensionRegistry;
import com.questrail.msgrpc.msgpack.ExtensionValue;
import com.questrail.msgrpc.msgpack.MessagePackDecoder;
import com.questrail.msgrpc.msgpack.MessagePackException;
import com.questrail.msgrpc.msgpack.MessagePackType;
import com.questrail.msgrpc.msgpack.RawValue;

import java.io.EOFException;
import java.io.IOException;
import java.lang.reflect.Array;
import java.lang.reflect.Constructor;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * ValueDecoder
 * -----------------------------------------------------------------------------
 * Binds MessagePack values to Java types described by a
 * {@link java.lang.reflect.Type}.
 *
 * <p>Decoding into {@code Object} produces the dynamic representation:
 * {@code null}, {@code Boolean}, {@code Long} (or {@code BigInteger} above
 * {@code Long.MAX_VALUE}), {@code Double}, {@code String}, {@code byte[]},
 * {@code List<Object>}, {@code LinkedHashMap<Object, Object>}, and for
 * extensions either the registered domain value or an {@link ExtensionValue}.</p>
 *
 * <p>Every conversion failure consumes the offending value (and the remaining
 * members of any enclosing composite) before {@link ConvertException} is
 * thrown, so the decoder stays aligned on the next value.</p>
 */
public final class ValueDecoder
{
    private static final Map<Class<?>, Object> PRIMITIVE_ZEROS = new HashMap<>();

    static {
        PRIMITIVE_ZEROS.put(boolean.class, false);
        PRIMITIVE_ZEROS.put(byte.class, (byte) 0);
        PRIMITIVE_ZEROS.put(short.class, (short) 0);
        PRIMITIVE_ZEROS.put(char.class, '\0');
        PRIMITIVE_ZEROS.put(int.class, 0);
        PRIMITIVE_ZEROS.put(long.class, 0L);
        PRIMITIVE_ZEROS.put(float.class, 0f);
        PRIMITIVE_ZEROS.put(double.class, 0d);
    }

    private final ExtensionRegistry extensions;

    public ValueDecoder(ExtensionRegistry extensions) {
        this.extensions = Objects.requireNonNull(extensions, "extensions");
    }

    /** Decodes the whole of {@code raw} into {@code type}. */
    public Object decode(RawValue raw, Type type) throws IOException {
        return read(raw.newDecoder(), type);
    }

    /**
     * Reads the next value from {@code in} and binds it to {@code type}.
     *
     * @throws EOFException if no value remains
     */
    public Object read(MessagePackDecoder in, Type type) throws IOException {
        if (!in.unpack()) {
            throw new EOFException("msgpack: expected a value, found end of input");
        }
        return convert(in, type);
    }

    /**
     * Binds the value {@code in} is currently positioned on. For composites the
     * declared members are consumed as well.
     */
    public Object convert(MessagePackDecoder in, Type type) throws IOException {
        Class<?> target = rawClass(type);
        MessagePackType wire = in.type();

        if (target == Object.class) {
            return dynamic(in);
        }
        if (target == RawValue.class) {
            return in.readRaw();
        }
        if (wire == MessagePackType.NIL) {
            return nilValue(target);
        }
        if (target == Optional.class) {
            return Optional.ofNullable(convert(in, typeArgument(type, 0)));
        }
        if (target == boolean.class || target == Boolean.class) {
            if (wire != MessagePackType.BOOL) {
                throw mismatch(in, type);
            }
            return in.booleanValue();
        }
        if (isIntegral(target)) {
            return integral(in, type, target);
        }
        if (target == double.class || target == Double.class) {
            return numeric(in, type);
        }
        if (target == float.class || target == Float.class) {
            return (float) numeric(in, type);
        }
        if (target == BigInteger.class || target == Number.class) {
            if (wire == MessagePackType.FLOAT && target == Number.class) {
                return in.doubleValue();
            }
            if (wire != MessagePackType.INT && wire != MessagePackType.UINT) {
                throw mismatch(in, type);
            }
            return target == Number.class ? dynamic(in) : in.bigIntegerValue();
        }
        if (target == String.class || target == CharSequence.class) {
            if (wire != MessagePackType.STRING && wire != MessagePackType.BINARY) {
                throw mismatch(in, type);
            }
            return in.string();
        }
        if (target == char.class || target == Character.class) {
            if (wire != MessagePackType.STRING) {
                throw mismatch(in, type);
            }
            String s = in.string();
            if (s.length() != 1) {
                throw new ConvertException(wire, type, "expected a single character");
            }
            return s.charAt(0);
        }
        if (target == byte[].class) {
            if (wire != MessagePackType.BINARY && wire != MessagePackType.STRING) {
                return readArray(in, type, byte.class);
            }
            return in.bytes();
        }
        if (target == ExtensionValue.class) {
            if (wire != MessagePackType.EXTENSION) {
                throw mismatch(in, type);
            }
            return new ExtensionValue(in.extensionType(), in.bytes());
        }
        if (!extensions.isEmpty()) {
            Optional<? extends ExtensionCodec<?>> codec = extensions.forType(target);
            if (codec.isPresent()) {
                if (wire != MessagePackType.EXTENSION || in.extensionType() != codec.get().type()) {
                    throw mismatch(in, type);
                }
                return codec.get().decode(in.bytes());
            }
        }
        if (target.isEnum()) {
            return enumValue(in, type, target);
        }
        if (target.isArray()) {
            return readArray(in, type, componentType(type));
        }
        if (target == List.class || target == Collection.class || target == Iterable.class
                || target == ArrayList.class) {
            return readCollection(in, type, new ArrayList<>());
        }
        if (target == Set.class || target == LinkedHashSet.class) {
            return readCollection(in, type, new LinkedHashSet<>());
        }
        if (target == Map.class || target == LinkedHashMap.class || target == HashMap.class) {
            return readMap(in, type);
        }
        if (target.isRecord()) {
            return readRecord(in, type, target);
        }
        throw new ConvertException(skipAndReturnType(in), type, "unsupported target type");
    }

    // -------------------------------------------------------------------------
    // Scalars
    // -------------------------------------------------------------------------

    private Object dynamic(MessagePackDecoder in) throws IOException {
        return switch (in.type()) {
            case NIL -> null;
            case BOOL -> in.booleanValue();
            case INT -> in.longValue();
            case UINT -> {
                long bits = in.longValue();
                yield bits >= 0 ? (Object) bits : in.bigIntegerValue();
            }
            case FLOAT -> in.doubleValue();
            case STRING -> in.string();
            case BINARY -> in.bytes();
            case ARRAY_HEADER -> readCollection(in, List.class, new ArrayList<>());
            case MAP_HEADER -> readMap(in, Map.class);
            case EXTENSION -> {
                Optional<ExtensionCodec<?>> codec = extensions.forTag(in.extensionType());
                if (codec.isPresent()) {
                    yield codec.get().decode(in.bytes());
                }
                yield new ExtensionValue(in.extensionType(), in.bytes());
            }
        };
    }

    private static Object nilValue(Class<?> target) {
        if (target == Optional.class) {
            return Optional.empty();
        }
        return PRIMITIVE_ZEROS.get(target);
    }

    /** The value a missing argument or component of {@code type} takes. */
    public static Object absentValue(Type type) {
        return nilValue(rawClass(type));
    }

    private static boolean isIntegral(Class<?> c) {
        return c == long.class || c == Long.class
                || c == int.class || c == Integer.class
                || c == short.class || c == Short.class
                || c == byte.class || c == Byte.class;
    }

    private static Object integral(MessagePackDecoder in, Type type, Class<?> target) throws IOException {
        MessagePackType wire = in.type();
        if (wire != MessagePackType.INT && wire != MessagePackType.UINT) {
            throw mismatch(in, type);
        }
        long v = in.longValue();
        if (wire == MessagePackType.UINT && v < 0) {
            throw new ConvertException(wire, type, "value out of range");
        }
        if (target == long.class || target == Long.class) {
            return v;
        }
        if (target == int.class || target == Integer.class) {
            checkRange(v, Integer.MIN_VALUE, Integer.MAX_VALUE, wire, type);
            return (int) v;
        }
        if (target == short.class || target == Short.class) {
            checkRange(v, Short.MIN_VALUE, Short.MAX_VALUE, wire, type);
            return (short) v;
        }
        checkRange(v, Byte.MIN_VALUE, Byte.MAX_VALUE, wire, type);
        return (byte) v;
    }

    private static void checkRange(long v, long min, long max, MessagePackType wire, Type type)
            throws ConvertException {
        if (v < min || v > max) {
            throw new ConvertException(wire, type, "value " + v + " out of range");
        }
    }

    private static double numeric(MessagePackDecoder in, Type type) throws IOException {
        MessagePackType wire = in.type();
        if (wire != MessagePackType.FLOAT && wire != MessagePackType.INT && wire != MessagePackType.UINT) {
            throw mismatch(in, type);
        }
        return in.doubleValue();
    }

    private static Object enumValue(MessagePackDecoder in, Type type, Class<?> target) throws IOException {
        if (in.type() != MessagePackType.STRING) {
            throw mismatch(in, type);
        }
        String name = in.string();
        for (Object constant : target.getEnumConstants()) {
            if (((Enum<?>) constant).name().equals(name)) {
                return constant;
            }
        }
        throw new ConvertException(MessagePackType.STRING, type, "no constant named " + name);
    }

    // -------------------------------------------------------------------------
    // Composites
    // -------------------------------------------------------------------------

    private Object readArray(MessagePackDecoder in, Type type, Type componentType) throws IOException {
        if (in.type() != MessagePackType.ARRAY_HEADER) {
            throw mismatch(in, type);
        }
        int n = in.length();
        Object array = Array.newInstance(rawClass(componentType), n);
        for (int i = 0; i < n; i++) {
            Object element = member(in, componentType, i, n);
            if (element != null || !rawClass(componentType).isPrimitive()) {
                Array.set(array, i, element);
            }
        }
        return array;
    }

    private Collection<Object> readCollection(MessagePackDecoder in, Type type, Collection<Object> into)
            throws IOException {
        if (in.type() != MessagePackType.ARRAY_HEADER) {
            throw mismatch(in, type);
        }
        int n = in.length();
        Type elementType = typeArgument(type, 0);
        for (int i = 0; i < n; i++) {
            into.add(member(in, elementType, i, n));
        }
        return into;
    }

    private Map<Object, Object> readMap(MessagePackDecoder in, Type type) throws IOException {
        if (in.type() != MessagePackType.MAP_HEADER) {
            throw mismatch(in, type);
        }
        int n = in.length();
        int members = n * 2;
        Type keyType = typeArgument(type, 0);
        Type valueType = typeArgument(type, 1);
        Map<Object, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < n; i++) {
            Object key = member(in, keyType, 2 * i, members);
            Object value = member(in, valueType, 2 * i + 1, members);
            map.put(key, value);
        }
        return map;
    }

    private Object readRecord(MessagePackDecoder in, Type type, Class<?> target) throws IOException {
        RecordComponent[] components = target.getRecordComponents();
        Object[] values = new Object[components.length];
        for (int i = 0; i < components.length; i++) {
            values[i] = absentValue(components[i].getGenericType());
        }

        MessagePackType wire = in.type();
        if (wire == MessagePackType.ARRAY_HEADER) {
            int n = in.length();
            for (int i = 0; i < n; i++) {
                if (i < components.length) {
                    values[i] = member(in, components[i].getGenericType(), i, n);
                } else {
                    nextMember(in);
                    in.skip();
                }
            }
        } else if (wire == MessagePackType.MAP_HEADER) {
            int n = in.length();
            int members = n * 2;
            for (int i = 0; i < n; i++) {
                Object key = member(in, Object.class, 2 * i, members);
                int index = componentIndex(components, key);
                if (index < 0) {
                    nextMember(in);
                    in.skip();
                } else {
                    values[index] = member(in, components[index].getGenericType(), 2 * i + 1, members);
                }
            }
        } else {
            throw mismatch(in, type);
        }
        return construct(target, components, values, wire, type);
    }

    private static int componentIndex(RecordComponent[] components, Object key) {
        if (key instanceof String name) {
            for (int i = 0; i < components.length; i++) {
                if (components[i].getName().equals(name)) {
                    return i;
                }
            }
        }
        return -1;
    }

    private static Object construct(Class<?> target, RecordComponent[] components, Object[] values,
                                     MessagePackType wire, Type type) throws MessagePackException {
        Class<?>[] types = new Class<?>[components.length];
        for (int i = 0; i < components.length; i++) {
            types[i] = components[i].getType();
        }
        try {
            Constructor<?> ctor = target.getDeclaredConstructor(types);
            ctor.trySetAccessible();
            return ctor.newInstance(values);
        } catch (InvocationTargetException e) {
            throw new ConvertException(wire, type, "constructor rejected value: " + e.getCause().getMessage());
        } catch (ReflectiveOperationException e) {
            throw new MessagePackException("msgpack: cannot construct " + target.getName(), e);
        }
    }

    /**
     * Reads member {@code index} of a composite with {@code count} members. If
     * binding fails, the members after it are skipped before rethrowing.
     */
    private Object member(MessagePackDecoder in, Type type, int index, int count) throws IOException {
        nextMember(in);
        try {
            return convert(in, type);
        } catch (ConvertException e) {
            for (int i = index + 1; i < count; i++) {
                nextMember(in);
                in.skip();
            }
            throw e;
        }
    }

    private static void nextMember(MessagePackDecoder in) throws IOException {
        if (!in.unpack()) {
            throw new EOFException("msgpack: unexpected end of input inside composite value");
        }
    }

    private static ConvertException mismatch(MessagePackDecoder in, Type type) throws IOException {
        return new ConvertException(skipAndReturnType(in), type);
    }

    private static MessagePackType skipAndReturnType(MessagePackDecoder in) throws IOException {
        MessagePackType wire = in.type();
        in.skip();
        return wire;
    }

    // -------------------------------------------------------------------------
    // Type helpers
    // -------------------------------------------------------------------------

    public static Class<?> rawClass(Type type) {
        if (type instanceof Class<?> c) {
            return c;
        }
        if (type instanceof ParameterizedType p) {
            return rawClass(p.getRawType());
        }
        if (type instanceof GenericArrayType g) {
            return Array.newInstance(rawClass(g.getGenericComponentType()), 0).getClass();
        }
        if (type instanceof WildcardType w) {
            return rawClass(w.getUpperBounds()[0]);
        }
        if (type instanceof TypeVariable<?> v) {
            Type[] bounds = v.getBounds();
            return bounds.length == 0 ? Object.class : rawClass(bounds[0]);
        }
        return Object.class;
    }

    private static Type typeArgument(Type type, int index) {
        if (type instanceof ParameterizedType p) {
            Type[] args = p.getActualTypeArguments();
            if (index < args.length) {
                return args[index];
            }
        }
        return Object.class;
    }

    private static Type componentType(Type type) {
        if (type instanceof GenericArrayType g) {
            return g.getGenericComponentType();
        }
        return rawClass(type).getComponentType();
    }
}
