/** General-purpose leaf specifications for numbers and strings. */
package com.criterion.specification.common;
