/**
 * Language Runtime Protocol model: the record shapes exchanged with a generic debugger front-end.
 *
 * <ul>
 *   <li>{@link com.lrp.protocol.model} – {@link com.lrp.protocol.model.ModelElement} /
 *       {@link com.lrp.protocol.model.ASTElement}, ids, locations and the canonical
 *       {@link com.lrp.protocol.model.WireRecord} ({@code id, type, attributes, children, refs, location?})</li>
 *   <li>{@link com.lrp.protocol.message} – request arguments and response envelopes (parse, init, step,
 *       runtime state, breakpoint types, breakpoint check)</li>
 *   <li>{@link com.lrp.protocol.error} – malformed tree, unresolved reference and recursion limit failures</li>
 *   <li>{@link com.lrp.protocol.validate} – ref resolution check over one response tree</li>
 *   <li>{@link com.lrp.protocol.json} – {@link com.lrp.protocol.json.LrpJson} {@code toJson}/{@code fromJson}</li>
 *   <li>{@link com.lrp.protocol.LanguageRuntime} – the request contract a language backend implements</li>
 * </ul>
 */
package com.lrp.protocol;
