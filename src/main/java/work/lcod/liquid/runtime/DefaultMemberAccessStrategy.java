package work.lcod.liquid.runtime;

import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Member table filled at configuration time. {@link #register(Class)} exposes the public
 * fields, getters and record components of a type; explicit accessors can be added with
 * {@link #register(Class, String, Class, Function)}. Subtypes of a registered type see its
 * members.
 */
public final class DefaultMemberAccessStrategy implements MemberAccessStrategy {
    private final Map<Class<?>, Map<String, MemberAccessor>> members = new ConcurrentHashMap<>();

    public DefaultMemberAccessStrategy register(Class<?> type) {
        Objects.requireNonNull(type, "type");
        var table = table(type);
        for (Field field : type.getFields()) {
            if (Modifier.isStatic(field.getModifiers())) {
                continue;
            }
            field.trySetAccessible();
            table.putIfAbsent(key(field.getName()), new FieldAccessor(field, field.getType(), elementType(field.getGenericType())));
        }
        if (type.isRecord()) {
            for (var component : type.getRecordComponents()) {
                var accessor = component.getAccessor();
                accessor.trySetAccessible();
                table.put(key(component.getName()), new MethodAccessor(accessor, component.getType(), elementType(component.getGenericType())));
            }
        }
        for (Method method : type.getMethods()) {
            if (Modifier.isStatic(method.getModifiers()) || method.getParameterCount() != 0 || method.getDeclaringClass() == Object.class) {
                continue;
            }
            var name = propertyName(method);
            if (name == null) {
                continue;
            }
            method.trySetAccessible();
            table.putIfAbsent(key(name), new MethodAccessor(method, method.getReturnType(), elementType(method.getGenericReturnType())));
        }
        return this;
    }

    @SuppressWarnings("unchecked")
    public <T> DefaultMemberAccessStrategy register(Class<T> type, String name, Class<?> valueType, Function<? super T, ?> getter) {
        Objects.requireNonNull(getter, "getter");
        table(type).put(key(name), new FunctionAccessor((Function<Object, ?>) getter, valueType == null ? Object.class : valueType));
        return this;
    }

    public boolean isRegistered(Class<?> type) {
        return members.containsKey(type);
    }

    @Override
    public MemberAccessor getAccessor(Class<?> type, String name) {
        if (type == null || name == null) {
            return null;
        }
        var normalized = key(name);
        for (Class<?> current = type; current != null; current = current.getSuperclass()) {
            var table = members.get(current);
            if (table != null) {
                var accessor = table.get(normalized);
                if (accessor != null) {
                    return accessor;
                }
            }
            for (var contract : current.getInterfaces()) {
                var contractTable = members.get(contract);
                if (contractTable != null && contractTable.containsKey(normalized)) {
                    return contractTable.get(normalized);
                }
            }
        }
        return null;
    }

    private Map<String, MemberAccessor> table(Class<?> type) {
        return members.computeIfAbsent(type, ignored -> new ConcurrentHashMap<>());
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    private static String propertyName(Method method) {
        var name = method.getName();
        if (name.startsWith("get") && name.length() > 3 && method.getReturnType() != void.class) {
            return name.substring(3);
        }
        if (name.startsWith("is") && name.length() > 2
            && (method.getReturnType() == boolean.class || method.getReturnType() == Boolean.class)) {
            return name.substring(2);
        }
        return null;
    }

    private static Class<?> elementType(Type type) {
        if (type instanceof Class<?> raw) {
            return raw.isArray() ? raw.getComponentType() : null;
        }
        if (type instanceof ParameterizedType parameterized
            && parameterized.getRawType() instanceof Class<?> raw
            && Iterable.class.isAssignableFrom(raw)) {
            var arguments = parameterized.getActualTypeArguments();
            if (arguments.length == 1) {
                if (arguments[0] instanceof Class<?> element) {
                    return element;
                }
                if (arguments[0] instanceof ParameterizedType nested && nested.getRawType() instanceof Class<?> element) {
                    return element;
                }
            }
        }
        return null;
    }

    private record FieldAccessor(Field field, Class<?> type, Class<?> elementType) implements MemberAccessor {
        @Override
        public Object get(Object target) {
            try {
                return field.get(target);
            } catch (IllegalAccessException ex) {
                throw new IllegalStateException("Cannot read field " + field.getName(), ex);
            }
        }
    }

    private record MethodAccessor(Method method, Class<?> type, Class<?> elementType) implements MemberAccessor {
        @Override
        public Object get(Object target) {
            try {
                return method.invoke(target);
            } catch (IllegalAccessException ex) {
                throw new IllegalStateException("Cannot read member " + method.getName(), ex);
            } catch (InvocationTargetException ex) {
                var cause = ex.getCause();
                if (cause instanceof RuntimeException runtime) {
                    throw runtime;
                }
                throw new IllegalStateException("Member " + method.getName() + " failed", cause);
            }
        }
    }

    private record FunctionAccessor(Function<Object, ?> getter, Class<?> type) implements MemberAccessor {
        @Override
        public Object get(Object target) {
            return getter.apply(target);
        }

        @Override
        public Class<?> elementType() {
            return null;
        }
    }
}
