/*
 * Copyright 2026 dorkbox, llc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dorkbox.publisher.callback;

import java.util.Arrays;

import com.esotericsoftware.reflectasm.MethodAccess;

import dorkbox.publisher.subscription.Subscription;

/**
 * Builds subscription handles from functions, or from a receiver and one of its methods.
 * <p/>
 * Every method returns a new handle whose only strong reference belongs to the caller. A receiver is captured by the callback, and only
 * strong references hold the callback, so publishers never keep a receiver alive. A listener that stores its own handle in a field
 * receives publications until it closes the handle, or until it becomes unreachable and is collected.
 * <p/>
 * <pre>
 * this.subscription = Callbacks.bind(this, Client::handler);
 * publication.subscribe(this.subscription);
 * </pre>
 *
 * @author dorkbox, llc
 */
public final
class Callbacks {

    @FunctionalInterface
    public
    interface Method0<R> {
        void invoke(R receiver);
    }

    @FunctionalInterface
    public
    interface Method1<R, T1> {
        void invoke(R receiver, T1 arg1);
    }

    @FunctionalInterface
    public
    interface Method2<R, T1, T2> {
        void invoke(R receiver, T1 arg1, T2 arg2);
    }

    @FunctionalInterface
    public
    interface Method3<R, T1, T2, T3> {
        void invoke(R receiver, T1 arg1, T2 arg2, T3 arg3);
    }


    private
    Callbacks() {
    }

    // free functions

    public static
    Subscription<Callback0> of(final Callback0 function) {
        return Subscription.create(function);
    }

    public static
    <T1> Subscription<Callback1<T1>> of(final Callback1<T1> function) {
        return Subscription.create(function);
    }

    public static
    <T1, T2> Subscription<Callback2<T1, T2>> of(final Callback2<T1, T2> function) {
        return Subscription.create(function);
    }

    public static
    <T1, T2, T3> Subscription<Callback3<T1, T2, T3>> of(final Callback3<T1, T2, T3> function) {
        return Subscription.create(function);
    }

    // receiver + method reference, checked by the compiler

    public static
    <R> Subscription<Callback0> bind(final R receiver, final Method0<R> method) {
        checkReceiver(receiver);
        return Subscription.create(() -> method.invoke(receiver));
    }

    public static
    <R, T1> Subscription<Callback1<T1>> bind(final R receiver, final Method1<R, T1> method) {
        checkReceiver(receiver);
        return Subscription.create((T1 arg1) -> method.invoke(receiver, arg1));
    }

    public static
    <R, T1, T2> Subscription<Callback2<T1, T2>> bind(final R receiver, final Method2<R, T1, T2> method) {
        checkReceiver(receiver);
        return Subscription.create((T1 arg1, T2 arg2) -> method.invoke(receiver, arg1, arg2));
    }

    public static
    <R, T1, T2, T3> Subscription<Callback3<T1, T2, T3>> bind(final R receiver, final Method3<R, T1, T2, T3> method) {
        checkReceiver(receiver);
        return Subscription.create((T1 arg1, T2 arg2, T3 arg3) -> method.invoke(receiver, arg1, arg2, arg3));
    }

    // receiver + method name, checked when binding

    /**
     * Binds the public method with the given name and no parameters. Any return value is ignored.
     *
     * @throws BindingException if the receiver is null, or has no such public method
     */
    public static
    Subscription<Callback0> bind(final Object receiver, final String methodName) {
        final BoundMethod method = lookup(receiver, methodName);
        return Subscription.create(() -> method.invoke());
    }

    /**
     * Binds the public method with the given name and parameter type. Pass {@code int.class} (and so on) for primitive parameters.
     *
     * @throws BindingException if the receiver is null, or has no such public method
     */
    public static
    <T1> Subscription<Callback1<T1>> bind(final Object receiver, final String methodName, final Class<T1> type1) {
        final BoundMethod method = lookup(receiver, methodName, type1);
        return Subscription.create((T1 arg1) -> method.invoke(arg1));
    }

    /**
     * Binds the public method with the given name and parameter types. Pass {@code int.class} (and so on) for primitive parameters.
     *
     * @throws BindingException if the receiver is null, or has no such public method
     */
    public static
    <T1, T2> Subscription<Callback2<T1, T2>> bind(final Object receiver, final String methodName,
                                                  final Class<T1> type1, final Class<T2> type2) {
        final BoundMethod method = lookup(receiver, methodName, type1, type2);
        return Subscription.create((T1 arg1, T2 arg2) -> method.invoke(arg1, arg2));
    }

    /**
     * Binds the public method with the given name and parameter types. Pass {@code int.class} (and so on) for primitive parameters.
     *
     * @throws BindingException if the receiver is null, or has no such public method
     */
    public static
    <T1, T2, T3> Subscription<Callback3<T1, T2, T3>> bind(final Object receiver, final String methodName,
                                                          final Class<T1> type1, final Class<T2> type2, final Class<T3> type3) {
        final BoundMethod method = lookup(receiver, methodName, type1, type2, type3);
        return Subscription.create((T1 arg1, T2 arg2, T3 arg3) -> method.invoke(arg1, arg2, arg3));
    }


    private static
    void checkReceiver(final Object receiver) {
        if (receiver == null) {
            throw new NullPointerException("receiver");
        }
    }

    private static
    BoundMethod lookup(final Object receiver, final String methodName, final Class<?>... parameterTypes) {
        if (receiver == null) {
            throw new BindingException("Cannot bind method '" + methodName + "' to a null receiver");
        }

        final Class<?> receiverClass = receiver.getClass();
        try {
            final MethodAccess access = MethodAccess.get(receiverClass);
            final int index = access.getIndex(methodName, parameterTypes);
            return new BoundMethod(access, index, receiver);
        } catch (RuntimeException e) {
            throw new BindingException("Unable to bind " + receiverClass.getName() + "." + methodName +
                                       Arrays.toString(parameterTypes) + ". It must be a public method of a public class.", e);
        }
    }


    private static final
    class BoundMethod {
        private final MethodAccess access;
        private final int index;
        private final Object receiver;

        BoundMethod(final MethodAccess access, final int index, final Object receiver) {
            this.access = access;
            this.index = index;
            this.receiver = receiver;
        }

        void invoke(final Object... args) {
            this.access.invoke(this.receiver, this.index, args);
        }
    }
}
