/*
 * Copyright 2018,2019, Regents of the University of Lancaster
 * All rights reserved.
 * 
 * Redistribution and use in source and binary forms, with or without
 * modification, are permitted provided that the following conditions are
 * met:
 * 
 *  * Redistributions of source code must retain the above copyright
 *    notice, this list of conditions and the following disclaimer.
 * 
 *  * Redistributions in binary form must reproduce the above copyright
 *    notice, this list of conditions and the following disclaimer in the
 *    documentation and/or other materials provided with the
 *    distribution.
 * 
 *  * Neither the name of the University of Lancaster nor the names of
 *    its contributors may be used to endorse or promote products derived
 *    from this software without specific prior written permission.
 * 
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS
 * "AS IS" AND ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT
 * LIMITED TO, THE IMPLIED WARRANTIES OF MERCHANTABILITY AND FITNESS FOR
 * A PARTICULAR PURPOSE ARE DISCLAIMED. IN NO EVENT SHALL THE COPYRIGHT
 * OWNER OR CONTRIBUTORS BE LIABLE FOR ANY DIRECT, INDIRECT, INCIDENTAL,
 * SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES (INCLUDING, BUT NOT
 * LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES; LOSS OF USE,
 * DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND ON ANY
 * THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT LIABILITY, OR TORT
 * (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE
 * OF THIS SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.
 *
 *
 * Author: Steven Simpson <s.simpson@lancaster.ac.uk>
 */

package uk.ac.lancs.logging;

import java.lang.invoke.MethodHandle;
import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.util.HashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Logs messages formatted according to annotations on the methods of a
 * sub-interface. See the {@linkplain uk.ac.lancs.logging package
 * description} for usage.
 * 
 * @author simpsons
 */
public interface FormattedLogger {
    /**
     * Get the unformatted logger that supports this formatted logger.
     * 
     * @return the supporting unformatted logger
     */
    Logger base();

    /**
     * Get a formatted logger for a given type, basing it on the named
     * logger. It is equivalent to:
     * 
     * <pre>
     * FormattedLogger.{@linkplain #get(Logger, Class) get}({@linkplain Logger#getLogger(String) Logger.getLogger}(name), type)
     * </pre>
     * 
     * @param <T> the formatted type
     * 
     * @param name the logger name, to be supplied to
     * {@link Logger#getLogger(String)}
     * 
     * @param type the formatted type
     * 
     * @return the requested formatted logger
     */
    public static <T extends FormattedLogger> T get(String name,
                                                    Class<T> type) {
        return get(Logger.getLogger(name), type);
    }

    /**
     * Get a formatted logger for a given type, basing it on the given
     * logger.
     * 
     * @param <T> the formatted type
     * 
     * @param logger the base logger that the formatted logger will
     * delegate to
     * 
     * @param type the interface type annotated with the message formats
     * 
     * @return the requested formatted logger
     * 
     * @throws IllegalArgumentException if a method of the type returns
     * a value, throws checked exceptions, or has no format
     */
    public static <T extends FormattedLogger> T get(Logger logger,
                                                    Class<T> type) {
        /* Bind our generic function to this specific logger. */
        MethodHandle logHandle = Statics.logHandle.bindTo(logger);

        /* Map each declared method to a handle. */
        Map<Method, MethodHandle> translation = new HashMap<>();
        for (Method cand : type.getMethods()) {
            if (cand.equals(Statics.baseMethod)) continue;

            if (cand.getReturnType() != Void.TYPE)
                throw new IllegalArgumentException("method " + cand
                    + " does not return void but " + cand.getReturnType());
            if (cand.getExceptionTypes().length > 0)
                throw new IllegalArgumentException("method " + cand
                    + " throws");

            Format m = cand.getAnnotation(Format.class);
            if (m == null) throw new IllegalArgumentException("method "
                + cand + " not a log message");

            /* Determine the log level for this message, using the
             * declaring interface type's setting as a default. */
            Detail detail = cand.getAnnotation(Detail.class);
            if (detail == null)
                detail = cand.getDeclaringClass().getAnnotation(Detail.class);
            final Level lvl = detail == null ? Level.INFO : detail.value().level;

            translation.put(cand, logHandle.bindTo(lvl).bindTo(m.value()));
        }

        InvocationHandler actions = new InvocationHandler() {
            @Override
            public Object invoke(Object proxy, Method meth, Object[] args)
                throws Throwable {
                if (meth.equals(Statics.baseMethod)) return logger;
                MethodHandle handle = translation.get(meth);
                if (handle != null) {
                    handle.invoke(args);
                    return null;
                }
                switch (meth.getName()) {
                case "toString":
                    return type.getName() + "[" + logger.getName() + "]";
                case "hashCode":
                    return System.identityHashCode(proxy);
                case "equals":
                    return proxy == args[0];
                default:
                    throw new UnsupportedOperationException(meth.toString());
                }
            }
        };
        return type.cast(Proxy.newProxyInstance(type.getClassLoader(),
                                                new Class<?>[] { type },
                                                actions));
    }
}
