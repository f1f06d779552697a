/**
 * B-spline parametrization engine.
 *
 * <p>Derives control frames (degree, control points, knots, optional weights) from fit points
 * or control points. All classes are pure functions over immutable inputs.</p>
 *
 * <h2>Entry Points</h2>
 * <ul>
 *   <li>{@link com.ryuqq.graphics.core.spline.ControlFrameBuilder} - Open, closed, rational and approximated frames</li>
 *   <li>{@link com.ryuqq.graphics.core.spline.Parametrization} - Uniform, chord-length and centripetal parameter vectors</li>
 *   <li>{@link com.ryuqq.graphics.core.spline.KnotVectors} - Clamped, open uniform, periodic and approximation knots</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Graphics Team
 */
package com.ryuqq.graphics.core.spline;
