/**
 **
 ** EProperties.java - typed Properties with array encoding helpers
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  EProperties.java is free software: you can redistribute it and/or modify
 **  it under the terms of the GNU General Public License as published by
 **  the Free Software Foundation, either version 3 of the License, or
 **  (at your option) any later version.
 **
 **  This program is distributed in the hope that it will be useful,
 **  but WITHOUT ANY WARRANTY; without even the implied warranty of
 **  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 **  GNU General Public License for more details.
 **
 **  You should have received a copy of the GNU General Public License
 **  along with this program.  If not, see <http://www.gnu.org/licenses/>.
 ** -----------------------------------------------------------------------------**
 **
 */

package com.elphel.driftcorr.common;

import java.util.Properties;

/**
 * Properties with typed getters and the space-separated array encoding used by all
 * parameter classes. 2D arrays are stored row by row, rows separated by ";".
 */
public class EProperties extends Properties{
	private static final long serialVersionUID = -425120416815883045L;
	public int getProperty(String key, int value){
		return Integer.parseInt(getProperty(key, ""+value));
	}
	public double getProperty(String key, double value){
		return Double.parseDouble(getProperty(key, ""+value));
	}
	public boolean getProperty(String key, boolean value){
		return Boolean.parseBoolean(getProperty(key, ""+value));
	}
	public double [] getProperty(String key, double [] value){
		String s = getProperty(key);
		return (s == null) ? value : str_to_darr(s);
	}

	public static String arr_to_str(int [] arr) {
		String s = "";
		for (int i:arr) s+= i+" ";
		return s.trim();
	}

	public static String arr_to_str(double [] arr) {
		StringBuilder sb = new StringBuilder();
		for (double d:arr) sb.append(d).append(' ');
		return sb.toString().trim();
	}

	public static String arr_to_str(boolean [] arr) {
		String s = "";
		for (boolean c:arr) s+= (c?1:0)+" ";
		return s.trim();
	}

	public static String arr_to_str(double [][] arr) {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < arr.length; i++) {
			sb.append(arr_to_str(arr[i]));
			if (i < (arr.length - 1)){
				sb.append(';');
			}
		}
		return sb.toString();
	}

	public static boolean [] str_to_barr(String s) {
		int [] iarr = str_to_iarr(s);
		if (iarr == null) return null;
		boolean [] barr = new boolean [iarr.length];
		for (int i = 0; i < barr.length; i++) {
			barr[i] = iarr[i] != 0;
		}
		return barr;
	}

	public static int [] str_to_iarr(String s) {
		String [] sa = split(s);
		if (sa == null) return null;
		int [] iarr = new int [sa.length];
		for (int i = 0; i < sa.length; i++) {
			iarr[i]=Integer.parseInt(sa[i]);
		}
		return iarr;
	}

	public static double [] str_to_darr(String s) {
		String [] sa = split(s);
		if (sa == null) return null;
		double [] darr = new double [sa.length];
		for (int i = 0; i < sa.length; i++) {
			darr[i]=Double.parseDouble(sa[i]);
		}
		return darr;
	}

	public static double [][] str_to_darr2(String s) {
		if ((s == null) || s.trim().isEmpty()) return null;
		String [] rows = s.split(";");
		double [][] darr = new double [rows.length][];
		for (int i = 0; i < rows.length; i++) {
			darr[i] = str_to_darr(rows[i]);
			if (darr[i] == null) darr[i] = new double[0];
		}
		return darr;
	}

	/**
	 * Read an optional double array property.
	 * @param properties source
	 * @param key full key
	 * @param dflt value returned when the key is absent
	 * @return parsed array or dflt
	 * @throws ConfigurationException if the value can not be parsed
	 */
	public static double [] getDoubles(Properties properties, String key, double [] dflt) {
		String s = properties.getProperty(key);
		if (s == null) return dflt;
		try {
			return str_to_darr(s);
		} catch (NumberFormatException e) {
			throw new ConfigurationException("Invalid numeric list for "+key+": \""+s+"\"", e);
		}
	}

	private static String [] split(String s) {
		if ((s == null) || s.trim().isEmpty()) return null;
		if (s.indexOf(",") >= 0) {
			return s.trim().split("\\s*,\\s*");
		}
		return s.trim().split("\\s+");
	}
}
