/*
 * API.java
 *
 * This source file is part of the FoundationDB open source project
 *
 * Copyright 2015-2026 Apple Inc. and the FoundationDB project authors
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

package org.extsort.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks how stable a public type, constructor, method or field is for code outside of extsort.
 *
 * <p>
 * Members of an annotated type inherit the type's status unless they carry their own annotation.
 * A status may become more stable at any time. It may only become less stable as described on
 * each {@link Status} constant.
 * </p>
 */
@Target({ElementType.TYPE, ElementType.METHOD, ElementType.CONSTRUCTOR, ElementType.FIELD})
@Retention(RetentionPolicy.CLASS)
@Documented
public @interface API {
    /**
     * Get the stability of the annotated element.
     * @return the stability status
     */
    Status value();

    /**
     * Stability levels, from least to most stable.
     */
    enum Status {
        /**
         * Only {@code public} so that another extsort package can reach it. May change at any time.
         */
        INTERNAL,

        /**
         * Scheduled for removal. May be removed in the next minor release.
         */
        DEPRECATED,

        /**
         * Still being designed. May change or disappear without notice.
         */
        EXPERIMENTAL,

        /**
         * Will not change before the next minor release.
         */
        UNSTABLE,

        /**
         * Will not change incompatibly before the next major release.
         */
        STABLE
    }
}
