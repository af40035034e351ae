/*
 * Copyright Switchboard Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

/**
 * Address handling for server sessions.
 *
 * <ul>
 *   <li>{@link io.switchboard.client.internal.net.UrlNormalizer} - turns user input into a
 *       canonical http(s) url, reporting rejections as {@link io.switchboard.client.internal.net.UrlValidation} values</li>
 *   <li>{@link io.switchboard.client.internal.net.DisplayNames} - derives the short label shown for a session</li>
 * </ul>
 */
@ReturnValuesAreNonnullByDefault
@DefaultAnnotationForParameters(NonNull.class)
@DefaultAnnotation(NonNull.class)
package io.switchboard.client.internal.net;

import edu.umd.cs.findbugs.annotations.DefaultAnnotation;
import edu.umd.cs.findbugs.annotations.DefaultAnnotationForParameters;
import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.ReturnValuesAreNonnullByDefault;
