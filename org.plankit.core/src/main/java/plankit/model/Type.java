/* 
 * Plankit -- Copyright (c) 2024-present, the Plankit authors
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package plankit.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * The type of a fluent, a parameter, an object or an expression: booleans,
 * integers and reals (optionally bounded), or a user type with an optional
 * father.
 */
public abstract class Type {

	public static final Type BOOL = new BoolType();
	public static final Type INT = new NumericType(true, null, null);
	public static final Type REAL = new NumericType(false, null, null);

	Type() {}

	public static Type integer(long lower, long upper) {
		return new NumericType(true, BigDecimal.valueOf(lower), BigDecimal.valueOf(upper));
	}

	public static Type real(BigDecimal lower, BigDecimal upper) {
		return new NumericType(false, lower, upper);
	}

	public static UserType userType(String name) {
		return new UserType(name, null);
	}

	public static UserType userType(String name, UserType father) {
		return new UserType(name, father);
	}

	public boolean isBoolType() { return false; }
	public boolean isIntType()  { return false; }
	public boolean isRealType() { return false; }
	public boolean isUserType() { return false; }

	public final boolean isNumeric() {
		return isIntType() || isRealType();
	}

	/**
	 * Returns true if a value of the given type can be stored where a value
	 * of this type is expected. Bounds are not checked.
	 */
	public abstract boolean isCompatible(Type other);

	/**
	 * The boolean type.
	 */
	public static final class BoolType extends Type {
		private BoolType() {}

		@Override
		public boolean isBoolType() {
			return true;
		}

		@Override
		public boolean isCompatible(Type other) {
			return other.isBoolType();
		}

		public String toString() {
			return "bool";
		}
	}

	/**
	 * Integer and real types, with optional inclusive bounds.
	 */
	public static final class NumericType extends Type {
		private final boolean integer;
		private final BigDecimal lower, upper;

		private NumericType(boolean integer, BigDecimal lower, BigDecimal upper) {
			this.integer = integer;
			this.lower = lower;
			this.upper = upper;
		}

		public BigDecimal lowerBound() { return lower; }
		public BigDecimal upperBound() { return upper; }

		@Override
		public boolean isIntType() {
			return integer;
		}

		@Override
		public boolean isRealType() {
			return !integer;
		}

		@Override
		public boolean isCompatible(Type other) {
			return integer ? other.isIntType() : other.isNumeric();
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof NumericType))
				return false;
			NumericType other = (NumericType) o;
			return integer == other.integer && Objects.equals(lower, other.lower) && Objects.equals(upper, other.upper);
		}

		@Override
		public int hashCode() {
			return Objects.hash(integer, lower, upper);
		}

		public String toString() {
			String name = integer ? "integer" : "real";
			if (lower == null && upper == null)
				return name;
			return name + "[" + (lower == null ? "-inf" : lower) + ", " + (upper == null ? "inf" : upper) + "]";
		}
	}

	/**
	 * A user declared type of objects.
	 */
	public static final class UserType extends Type {
		private final String name;
		private final UserType father;

		private UserType(String name, UserType father) {
			this.name = Objects.requireNonNull(name);
			this.father = father;
		}

		public String name() {
			return name;
		}

		/** @return the father of this type, or null for a root type. */
		public UserType father() {
			return father;
		}

		@Override
		public boolean isUserType() {
			return true;
		}

		/** @return true if this type is the given one or one of its descendants. */
		public boolean isSubtypeOf(UserType other) {
			for (UserType t = this; t != null; t = t.father)
				if (t.equals(other))
					return true;
			return false;
		}

		@Override
		public boolean isCompatible(Type other) {
			return other instanceof UserType && ((UserType) other).isSubtypeOf(this);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof UserType))
				return false;
			UserType other = (UserType) o;
			return name.equals(other.name) && Objects.equals(father, other.father);
		}

		@Override
		public int hashCode() {
			return name.hashCode();
		}

		public String toString() {
			return name;
		}
	}
}
